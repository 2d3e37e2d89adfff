package org.fmtguard;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CheckerOptions accordingly: the file to check, where to
 * write the rewritten sources, and how to report problems.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CheckerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CheckerOptions object with settings derived from the arguments.
     * @throws UsageException if the arguments are invalid
     */
    public static CheckerOptions parseArguments(String[] args) {
        CheckerOptions parsedArgs = new CheckerOptions();
        processArgs(args, parsedArgs);

        if (parsedArgs.fileName == null && !parsedArgs.help && !parsedArgs.version) {
            throw new UsageException("Missing input file");
        }
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CheckerOptions object to configure.
     */
    private static void processArgs(String[] args, CheckerOptions parsedArgs) {
        boolean readingFiles = false; // after "--", everything is a file name

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingFiles || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(parsedArgs, arg);
            } else if (arg.equals("--")) {
                readingFiles = true;
            } else if (arg.startsWith("--")) {
                i = processLongSwitch(args, parsedArgs, arg, i);
            } else {
                processClusteredSwitches(parsedArgs, arg);
            }
        }
    }

    private static void processNonSwitchArgument(CheckerOptions parsedArgs, String arg) {
        if (parsedArgs.fileName != null) {
            throw new UsageException("Only one input file can be checked at a time, got " + parsedArgs.fileName + " and " + arg);
        }
        parsedArgs.fileName = arg;
    }

    /**
     * Processes clustered single-character switches (e.g., -dj).
     */
    private static void processClusteredSwitches(CheckerOptions parsedArgs, String arg) {
        for (int j = 1; j < arg.length(); j++) {
            char switchChar = arg.charAt(j);
            switch (switchChar) {
                case 'h' -> parsedArgs.help = true;
                case 'v' -> parsedArgs.version = true;
                case 'd' -> parsedArgs.debug = true;
                case 'j' -> parsedArgs.json = true;
                default -> throw new UsageException("Unrecognized switch: -" + switchChar);
            }
        }
    }

    /**
     * Processes long-form switches (e.g., --optimize out.c, --typecast=out.c, --json).
     *
     * @return The updated index after processing the switch and its value, if any.
     */
    private static int processLongSwitch(String[] args, CheckerOptions parsedArgs, String arg, int index) {
        String name = arg;
        String value = null;
        int eq = arg.indexOf('=');
        if (eq > 0) {
            name = arg.substring(0, eq);
            value = arg.substring(eq + 1);
        }

        switch (name) {
            case "--optimize" -> {
                if (value == null) {
                    value = requireValue(args, index, name);
                    index++;
                }
                parsedArgs.optimizePath = Paths.get(value);
            }
            case "--typecast" -> {
                if (value == null) {
                    value = requireValue(args, index, name);
                    index++;
                }
                parsedArgs.typecastPath = Paths.get(value);
            }
            case "--json" -> parsedArgs.json = true;
            case "--debug" -> parsedArgs.debug = true;
            case "--help" -> parsedArgs.help = true;
            case "--version" -> parsedArgs.version = true;
            default -> throw new UsageException("Unrecognized option: " + name);
        }
        if (value != null && !name.equals("--optimize") && !name.equals("--typecast")) {
            throw new UsageException("Option " + name + " does not take a value");
        }
        return index;
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index + 1 >= args.length || args[index + 1].isEmpty()) {
            throw new UsageException("Option " + name + " requires a path");
        }
        return args[index + 1];
    }

    public static String usage() {
        return "Usage: fmtguard [options] <file.c>\n"
                + "\n"
                + "Validate printf, sprintf and snprintf calls in a C source file.\n"
                + "\n"
                + "Options:\n"
                + "  --optimize <path>   write the file with calls replaced by safe_* variants\n"
                + "  --typecast <path>   write the file with every formatted argument cast\n"
                + "  -j, --json          print errors as JSON on standard output\n"
                + "  -d, --debug         trace the analysis on standard error\n"
                + "  -h, --help          show this help\n"
                + "  -v, --version       show the version\n";
    }

    /**
     * Options for a run of the checker.
     */
    public static class CheckerOptions {
        public String fileName = null;
        public Path optimizePath = null;
        public Path typecastPath = null;
        public boolean json = false;
        public boolean debug = false;
        public boolean help = false;
        public boolean version = false;

        @Override
        public String toString() {
            return "CheckerOptions{" +
                    "fileName='" + fileName + '\'' +
                    ", optimizePath=" + optimizePath +
                    ", typecastPath=" + typecastPath +
                    ", json=" + json +
                    ", debug=" + debug +
                    ", help=" + help +
                    ", version=" + version +
                    '}';
        }
    }
}
