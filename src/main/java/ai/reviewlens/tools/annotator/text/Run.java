package ai.reviewlens.tools.annotator.text;

/**
 * Contiguous slice of the subject text, either plain or annotated with one style.
 *
 * @param start       inclusive start offset in the subject text
 * @param end         exclusive end offset in the subject text
 * @param text        the exact original substring {@code [start, end)}
 * @param style       style tag, or {@code null} for plain text
 * @param sourceSetId id of the pattern set that produced the annotation, or {@code null} for plain text
 */
public record Run(int start, int end, String text, String style, String sourceSetId) {

    static Run plain(String subject, int start, int end) {
        return new Run(start, end, subject.substring(start, end), null, null);
    }

    static Run annotated(String subject, Match m) {
        return new Run(m.start(), m.end(), subject.substring(m.start(), m.end()), m.style(), m.sourceSetId());
    }

    public boolean isPlain() {
        return style == null;
    }

    public boolean isAnnotated() {
        return style != null;
    }
}
