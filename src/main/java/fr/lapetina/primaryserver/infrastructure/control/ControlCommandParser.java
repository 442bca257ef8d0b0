package fr.lapetina.primaryserver.infrastructure.control;

import fr.lapetina.primaryserver.domain.model.ReconfigRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses textual control commands into {@link ReconfigRequest}s.
 *
 * <pre>
 * --stop
 * --generator boxgen --nEvents 10 --startSeed 42
 * --configFile /path/run.yaml --trigger "min-primaries:5"
 * </pre>
 *
 * Values may be double-quoted to carry spaces. Unknown options, missing
 * values and malformed numbers are rejected.
 */
public final class ControlCommandParser {

    private ControlCommandParser() {
        // Utility class
    }

    public static ReconfigRequest parse(String command) {
        if (command == null || command.isBlank()) {
            throw new ControlCommandException("Empty control command");
        }
        List<String> tokens = tokenize(command);

        boolean stop = false;
        String generator = null;
        String trigger = null;
        Long startSeed = null;
        Integer nEvents = null;
        Integer chunkSize = null;
        String extKinFile = null;
        String embedIntoFile = null;
        String configFile = null;

        for (int i = 0; i < tokens.size(); i++) {
            String option = tokens.get(i);
            switch (option) {
                case "--stop" -> stop = true;
                case "--generator" -> generator = value(tokens, ++i, option);
                case "--trigger" -> trigger = value(tokens, ++i, option);
                case "--startSeed", "--seed" -> startSeed = parseLong(value(tokens, ++i, option), option);
                case "--nEvents", "-n" -> nEvents = parseCount(value(tokens, ++i, option), option, 0);
                case "--chunkSize" -> chunkSize = parseCount(value(tokens, ++i, option), option, 1);
                case "--extKinFile" -> extKinFile = value(tokens, ++i, option);
                case "--embedIntoFile" -> embedIntoFile = value(tokens, ++i, option);
                case "--configFile" -> configFile = value(tokens, ++i, option);
                default -> throw new ControlCommandException("Unknown option: " + option);
            }
        }

        if (stop) {
            return ReconfigRequest.stopRequest();
        }
        return new ReconfigRequest(false, generator, trigger, startSeed, nEvents, chunkSize,
                extKinFile, embedIntoFile, configFile);
    }

    private static String value(List<String> tokens, int index, String option) {
        if (index >= tokens.size() || tokens.get(index).startsWith("--")) {
            throw new ControlCommandException("Missing value for " + option);
        }
        return tokens.get(index);
    }

    private static long parseLong(String value, String option) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ControlCommandException("Invalid number for " + option + ": " + value, e);
        }
    }

    private static int parseCount(String value, String option, int min) {
        long parsed = parseLong(value, option);
        if (parsed < min || parsed > Integer.MAX_VALUE) {
            throw new ControlCommandException("Value for " + option + " out of range: " + value);
        }
        return (int) parsed;
    }

    static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean pending = false;
        for (char c : command.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
                pending = true;
            } else if (Character.isWhitespace(c) && !quoted) {
                if (pending) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    pending = false;
                }
            } else {
                current.append(c);
                pending = true;
            }
        }
        if (quoted) {
            throw new ControlCommandException("Unterminated quote in: " + command);
        }
        if (pending) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
