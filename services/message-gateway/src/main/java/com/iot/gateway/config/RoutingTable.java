package com.iot.gateway.config;

import com.iot.gateway.model.MessageType;

import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Message type to downstream base URL, fixed at startup.
 * Instances are immutable and safe to share between concurrent requests.
 */
public final class RoutingTable {

    private final Map<MessageType, URI> targets;

    private RoutingTable(Map<MessageType, URI> targets) {
        this.targets = Collections.unmodifiableMap(new EnumMap<>(targets));
    }

    /**
     * Builds the table from configured routes. Keys must be known message
     * type values; blank URLs are left out so the type stays unrouted.
     *
     * @throws IllegalArgumentException for an unknown type key or a URL that is not absolute
     */
    public static RoutingTable from(Map<String, String> routes) {
        Map<MessageType, URI> targets = new EnumMap<>(MessageType.class);
        routes.forEach((key, url) -> {
            MessageType type = MessageType.fromValue(key);
            if (url == null || url.isBlank()) {
                return;
            }
            URI uri = URI.create(stripTrailingSlash(url.trim()));
            if (!uri.isAbsolute()) {
                throw new IllegalArgumentException("Route for " + key + " must be an absolute URL: " + url);
            }
            targets.put(type, uri);
        });
        return new RoutingTable(targets);
    }

    public Optional<URI> baseUrl(MessageType type) {
        return Optional.ofNullable(targets.get(type));
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "RoutingTable" + targets;
    }
}
