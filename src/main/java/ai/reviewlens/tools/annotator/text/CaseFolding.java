package ai.reviewlens.tools.annotator.text;

/**
 * Length-preserving lower-casing and code point boundary checks.
 *
 * <p>{@link String#toLowerCase(java.util.Locale)} may change the UTF-16 length of a string
 * (for example U+0130 lower-cases to two chars), which would shift every offset after it.
 * {@link #fold(String)} lower-cases one code point at a time and leaves a code point
 * unchanged whenever its lower-case form has a different char count, so index {@code i} of
 * the folded text always corresponds to index {@code i} of the original.</p>
 */
final class CaseFolding {

    private CaseFolding() {}

    /**
     * Lower-cases {@code s} without changing its length.
     *
     * @param s input (non-null)
     * @return folded copy with {@code fold(s).length() == s.length()}
     */
    static String fold(String s) {
        final StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            final int cp = s.codePointAt(i);
            final int lower = Character.toLowerCase(cp);
            final int count = Character.charCount(cp);
            sb.appendCodePoint(Character.charCount(lower) == count ? lower : cp);
            i += count;
        }
        return sb.toString();
    }

    /**
     * Returns whether {@code index} sits on a code point boundary of {@code s}, i.e. does not
     * fall between the high and low halves of a surrogate pair.
     *
     * @param s     text
     * @param index offset in {@code [0, s.length()]}
     * @return {@code true} if slicing at {@code index} keeps every code point whole
     */
    static boolean isCodePointBoundary(String s, int index) {
        if (index <= 0 || index >= s.length()) return true;
        return !(Character.isHighSurrogate(s.charAt(index - 1)) && Character.isLowSurrogate(s.charAt(index)));
    }
}
