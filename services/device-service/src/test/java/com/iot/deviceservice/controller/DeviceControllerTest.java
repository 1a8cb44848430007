package com.iot.deviceservice.controller;

import com.iot.deviceservice.repository.DeviceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class DeviceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DeviceRepository deviceRepository;

    @Test
    void upsertDevice_withNewDevice_returnsOk() throws Exception {
        String deviceId = newDeviceId();

        upsert(deviceId, "{\"deviceId\": \"" + deviceId + "\", \"username\": \"alice\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Device updated successfully"))
                .andExpect(jsonPath("$.deviceId").value(deviceId));

        mockMvc.perform(get("/devices/{deviceId}/username", deviceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));
    }

    @Test
    void upsertDevice_repeated_keepsSingleMapping() throws Exception {
        String deviceId = newDeviceId();
        long before = deviceRepository.count();

        upsert(deviceId, "{\"username\": \"alice\"}").andExpect(status().isOk());
        upsert(deviceId, "{\"username\": \"alice\"}").andExpect(status().isOk());

        assertEquals(before + 1, deviceRepository.count());
        assertEquals("alice", deviceRepository.findById(deviceId).orElseThrow().getUsername());
    }

    @Test
    void upsertDevice_withNewUsername_replacesMapping() throws Exception {
        String deviceId = newDeviceId();

        upsert(deviceId, "{\"username\": \"alice\"}").andExpect(status().isOk());
        upsert(deviceId, "{\"username\": \"bob\"}").andExpect(status().isOk());

        mockMvc.perform(get("/devices/{deviceId}/username", deviceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("bob"));
    }

    @Test
    void upsertDevice_withBlankUsername_returnsBadRequest() throws Exception {
        upsert(newDeviceId(), "{\"username\": \"  \"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.username").exists());
    }

    @Test
    void upsertDevice_withMismatchedDeviceId_returnsBadRequest() throws Exception {
        String deviceId = newDeviceId();

        upsert(deviceId, "{\"deviceId\": \"someone-else\", \"username\": \"alice\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("does not match")));

        assertFalse(deviceRepository.existsById(deviceId));
    }

    @Test
    void upsertDevice_withInvalidJson_returnsBadRequest() throws Exception {
        upsert(newDeviceId(), "{\"username\": ")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid JSON format"));
    }

    @Test
    void getUsername_withUnknownDevice_returnsNotFound() throws Exception {
        String deviceId = newDeviceId();

        mockMvc.perform(get("/devices/{deviceId}/username", deviceId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Device " + deviceId + " not found"));
    }

    private ResultActions upsert(String deviceId, String payload) throws Exception {
        return mockMvc.perform(put("/devices/{deviceId}", deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload));
    }

    private static String newDeviceId() {
        return "sensor-" + UUID.randomUUID();
    }
}
