package io.dynaform.core.engine.dialect;

/** Helpers shared by the built-in dialects. */
final class Literals {

    private Literals() {}

    /** Removes one layer of matching single or double quotes, e.g. {@code "'Yes'" -> "Yes"}. */
    static String unquote(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }
}
