package com.metamodel.generator.codegen.util;

/**
 * Rendering of literal values in generated code.
 */
public class LiteralUtil {

    private LiteralUtil() {
        // Utility class
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest: "true" becomes "True".
     */
    public static String titleCase(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isLetter(ch)) {
                sb.append(previousIsLetter ? Character.toLowerCase(ch) : Character.toUpperCase(ch));
                previousIsLetter = true;
            } else {
                sb.append(ch);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * Double-quoted string literal.
     */
    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
