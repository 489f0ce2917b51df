package io.channelshub.config;

import io.channelshub.error.ConfigurationException;

/**
 * The {@code "a:b"} ports string of a forwarding channel. Both sides are required.
 */
public record PortPair(int first, int second) {

    public static PortPair parse(String channelName, String raw) {
        String example = "Expected format: 'local:dest' (e.g., '80:3923')";
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Channel '" + channelName + "': missing ports. " + example);
        }
        String[] parts = raw.trim().split(":", -1);
        if (parts.length != 2) {
            throw new ConfigurationException("Invalid port format '" + raw + "'. " + example);
        }
        if (parts[0].isBlank()) {
            throw new ConfigurationException(
                    "Invalid port format '" + raw + "'. Local port cannot be empty. " + example);
        }
        if (parts[1].isBlank()) {
            throw new ConfigurationException(
                    "Invalid port format '" + raw + "'. Destination port cannot be empty. " + example);
        }
        return new PortPair(port(parts[0], "local"), port(parts[1], "destination"));
    }

    private static int port(String raw, String side) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0 || value > 65_535) {
                throw new ConfigurationException("Invalid " + side + " port '" + raw + "': out of range 0-65535");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + side + " port '" + raw + "': not a number", e);
        }
    }

    @Override
    public String toString() {
        return first + ":" + second;
    }
}
