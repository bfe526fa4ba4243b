package io.perfdash.api.device;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;

/**
 * Static metadata of one device, exactly as the collector wrote it.
 * <p>
 * The raw document is kept untouched so every field surfaces unmodified.
 * The typed accessors return an empty value for absent fields and never
 * invent one.
 */
public record DeviceDetail(String folderName, JsonNode raw) {

    public String deviceId() {
        return text(raw.path("device_id"));
    }

    public String fullName() {
        return text(raw.path("model").path("full_name"));
    }

    public String androidVersion() {
        return text(raw.path("android").path("version"));
    }

    public String sdkLevel() {
        return text(raw.path("android").path("sdk_level"));
    }

    public OptionalDouble totalMemoryGb() {
        JsonNode node = raw.path("memory").path("total_memory_gb");
        if (node.isNumber()) {
            return OptionalDouble.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public String resolution() {
        return text(raw.path("screen").path("resolution"));
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : "";
    }
}
