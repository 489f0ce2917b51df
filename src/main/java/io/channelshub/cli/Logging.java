package io.channelshub.cli;

/**
 * Adjusts slf4j-simple through system properties. Must run before the first logger is
 * created, which is why the {@code --debug} option calls it while arguments are parsed.
 */
final class Logging {
    static final String DEFAULT_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";
    static final String SSHD_LEVEL = "org.slf4j.simpleLogger.log.org.apache.sshd";

    private Logging() {
    }

    static void enableDebug() {
        System.setProperty(DEFAULT_LEVEL, "debug");
        System.setProperty(SSHD_LEVEL, "info");
    }
}
