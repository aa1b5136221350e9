package org.lambdacalc.lexer;

/**
 * Character classes of the lambda surface syntax.
 */
public final class CharClasses {
    private CharClasses() {}

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isIdentifierChar(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public static boolean isValidSyntaxChar(char c) {
        return isIdentifierChar(c) || c == '(' || c == ')' || c == '.' || c == '\\';
    }

    /**
     * Check a candidate variable name: non-empty, starts with a letter, made of valid syntax characters.
     *
     * <p>Punctuation passes this check; the lexer never collects it into a name.
     */
    public static boolean isValidVariableName(String s) {
        if (s == null || s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!isValidSyntaxChar(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
