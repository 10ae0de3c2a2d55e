package com.mermaidbuilder.core.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text helpers for embedding user-supplied strings in Mermaid source.
 */
public final class MermaidText {

    private static final String HASH_ENTITY = "#35;";
    private static final String QUOTE_ENTITY = "#quot;";
    private static final String LINE_BREAK = "<br>";

    private static final Pattern PLAIN_YAML_SCALAR = Pattern.compile("[A-Za-z][A-Za-z0-9 _.()/+-]*");
    private static final Set<String> YAML_KEYWORDS = Set.of(
        "true", "false", "null", "yes", "no", "on", "off", "y", "n");

    private MermaidText() {
        // Utility class
    }

    /**
     * Escapes a label so it can be placed between double quotes.
     *
     * <p>Mermaid entity codes start with {@code #}, so literal hashes are encoded first and
     * the entities introduced afterwards are left intact. Double quotes become
     * {@code #quot;} and every line break ({@code \r\n}, {@code \n} or {@code \r}) becomes
     * {@code <br>}.
     *
     * @param text the label to escape (may be null)
     * @return escaped label, or empty string if input is null
     */
    public static String escapeLabel(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("#", HASH_ENTITY)
            .replace("\"", QUOTE_ENTITY)
            .replace("\r\n", LINE_BREAK)
            .replace("\n", LINE_BREAK)
            .replace("\r", LINE_BREAK);
    }

    /**
     * Wraps an escaped label in double quotes.
     *
     * @param text the label (may be null)
     * @return quoted, escaped label
     */
    public static String quote(String text) {
        return "\"" + escapeLabel(text) + "\"";
    }

    /**
     * Formats a value as a YAML scalar for the front matter.
     *
     * <p>Simple words are written plain, e.g. {@code Checkout}. Anything YAML could read as
     * another type or as structure (colons, {@code #}, quotes, line breaks, keywords such as
     * {@code yes}) is written as a double-quoted scalar with backslash escapes.
     *
     * @param value the value to format
     * @return YAML scalar representing exactly {@code value}
     */
    public static String yamlScalar(String value) {
        if (!value.isEmpty()
                && PLAIN_YAML_SCALAR.matcher(value).matches()
                && !value.endsWith(" ")
                && !YAML_KEYWORDS.contains(value.toLowerCase(Locale.ROOT))) {
            return value;
        }
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
