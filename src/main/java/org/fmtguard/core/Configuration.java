package org.fmtguard.core;

/**
 * Central configuration of the checker.
 * Contains constants that control command-line behavior and identify the build.
 */
public final class Configuration {

    public static final String toolName = "fmtguard";
    public static final String version = "1.0.0";

    // Exit statuses of the command-line tool
    public static final int EXIT_OK = 0;
    public static final int EXIT_SOURCE_ERRORS = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    // Prevent instantiation
    private Configuration() {
    }

    public static String getVersionString() {
        return toolName + " " + version;
    }
}
