package com.punchwheel.app.command;

import java.util.Arrays;
import java.util.Locale;

/**
 * 命令行子命令
 */
public enum PunchCommand {
    RUN("run"),
    TEST_NOTIFICATIONS("test-notifications");

    private final String value;

    PunchCommand(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 未给出子命令时默认 run
     */
    public static PunchCommand from(String arg) {
        if (arg == null || arg.isBlank()) {
            return RUN;
        }
        String v = arg.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.value.equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "unknown command '" + arg + "', expected one of: run, test-notifications"));
    }
}
