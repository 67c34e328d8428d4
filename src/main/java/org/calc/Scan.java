package org.calc;

/**
 * Character-level helpers the parser runs directly over the raw expression text.
 * Nothing here tokenizes; every helper works on {@link Slice} views of one backing string.
 */
public final class Scan {

    private Scan() {}

    // =========================================================
    // Slice
    // =========================================================

    /**
     * Half-open {@code [begin, end)} view over a backing string. Sub-slicing never copies.
     */
    public static final class Slice implements CharSequence {
        private final String src;
        private final int begin, end;

        public Slice(String src) { this(src, 0, src.length()); }

        private Slice(String src, int begin, int end) {
            this.src = src; this.begin = begin; this.end = end;
        }

        @Override public int length() { return end - begin; }
        @Override public char charAt(int index) { return src.charAt(begin + index); }
        char first() { return src.charAt(begin); }
        char last() { return src.charAt(end - 1); }

        /** Slice relative to this one, {@code from} inclusive, {@code to} exclusive. */
        public Slice slice(int from, int to) {
            if (from < 0 || to > length() || from > to) {
                throw new IndexOutOfBoundsException("slice [" + from + ", " + to + ") of length " + length());
            }
            return new Slice(src, begin + from, begin + to);
        }

        @Override public Slice subSequence(int start, int stop) { return slice(start, stop); }

        /** Drops up to {@code n} leading characters. */
        Slice drop(int n) { return slice(Math.min(n, length()), length()); }

        /** Drops up to {@code n} trailing characters. */
        Slice dropLast(int n) { return slice(0, length() - Math.min(n, length())); }

        int indexOf(char ch) {
            for (int i = 0; i < length(); i++) if (charAt(i) == ch) return i;
            return -1;
        }

        @Override public String toString() { return src.substring(begin, end); }
    }

    // =========================================================
    // Whitespace / prefix
    // =========================================================

    public static Slice trimWhitespace(Slice text) {
        int from = 0, to = text.length();
        while (from < to && Character.isWhitespace(text.charAt(from))) from++;
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
        return text.slice(from, to);
    }

    public static String trimWhitespace(String text) { return trimWhitespace(new Slice(text)).toString(); }

    /** Prefix test, compared over the shorter of the two lengths. */
    public static boolean startsWith(CharSequence haystack, String needle) {
        int n = Math.min(haystack.length(), needle.length());
        if (n != needle.length()) return false;
        for (int i = 0; i < n; i++) if (haystack.charAt(i) != needle.charAt(i)) return false;
        return true;
    }

    // =========================================================
    // Parentheses
    // =========================================================

    /**
     * True if no prefix closes more parentheses than it opens and the totals match.
     */
    public static boolean validParens(CharSequence text) {
        int counter = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                counter++;
            } else if (ch == ')') {
                if (--counter < 0) return false;
            }
        }
        return counter == 0;
    }

    /**
     * Strips whitespace and enclosing parenthesis pairs until neither applies.
     * A pair is only removed if what it encloses is balanced on its own, so
     * {@code ((1+2))} becomes {@code 1+2} while {@code (1)+(2)} is kept.
     */
    public static Slice simplifyParens(Slice text) {
        while (true) {
            text = trimWhitespace(text);
            if (text.length() == 0 || text.first() != '(' || text.last() != ')') return text;
            Slice inner = trimWhitespace(text.drop(1).dropLast(1));
            if (!validParens(inner)) return text;
            text = inner;
        }
    }

    public static String simplifyParens(String text) { return simplifyParens(new Slice(text)).toString(); }
}
