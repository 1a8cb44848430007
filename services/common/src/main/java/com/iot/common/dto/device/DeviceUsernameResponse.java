package com.iot.common.dto.device;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeviceUsernameResponse(
    @JsonProperty("username")
    String username
) {}
