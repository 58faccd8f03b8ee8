package dev.bykey.cli;

import java.util.OptionalInt;

/**
 * Command line options of {@link TallyMain}, parsed from {@code --name=value} arguments.
 *
 * @param input path of the JSON document
 * @param arrayField field holding the record array when the document is an object
 * @param keyField record field used as the key
 * @param sumField numeric record field to accumulate, or {@code null} to count
 * @param top number of best keys to print, empty for the whole association
 */
public record TallyOptions(
        String input,
        String arrayField,
        String keyField,
        String sumField,
        OptionalInt top
) {
    static final String DEFAULT_ARRAY_FIELD = "data";

    /**
     * Parses the arguments. Unknown arguments are ignored.
     *
     * @throws IllegalArgumentException if a required option is missing or a value is malformed
     */
    public static TallyOptions parse(String[] args) {
        String input = parseStringArg(args, "input", null);
        String keyField = parseStringArg(args, "key", null);
        if (input == null || keyField == null) {
            throw new IllegalArgumentException("--input and --key parameters are required");
        }
        String top = parseStringArg(args, "top", null);
        return new TallyOptions(
                input,
                parseStringArg(args, "array", DEFAULT_ARRAY_FIELD),
                keyField,
                parseStringArg(args, "sum", null),
                top == null ? OptionalInt.empty() : OptionalInt.of(parseTop(top))
        );
    }

    /**
     * Returns true when a numeric field is accumulated instead of counting records.
     */
    public boolean summing() {
        return sumField != null;
    }

    private static int parseTop(String value) {
        try {
            int k = Integer.parseInt(value);
            if (k < 0) {
                throw new IllegalArgumentException("Invalid value for top: " + value);
            }
            return k;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for top: " + value, e);
        }
    }

    private static String parseStringArg(String[] args, String name, String defaultValue) {
        String prefix = "--" + name + "=";
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                return arg.substring(prefix.length());
            }
        }
        return defaultValue;
    }
}
