package ai.reviewlens.tools.annotator.text;

/**
 * One located occurrence of one phrase, before or after overlap resolution.
 *
 * <p>Offsets are half-open UTF-16 indices into the original subject text, the same unit
 * {@link String#substring(int, int)} uses.</p>
 *
 * @param start       inclusive start offset
 * @param end         exclusive end offset
 * @param style       style tag of the owning {@link PatternSet}; {@code null} becomes {@code ""}
 * @param sourceSetId id of the owning {@link PatternSet}; {@code null} becomes {@code ""}
 * @param order       discovery rank of the phrase (set position, then phrase position)
 */
public record Match(int start, int end, String style, String sourceSetId, int order) {

    public Match {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0: " + start);
        }
        if (end <= start) {
            throw new IllegalArgumentException("end must be > start: [" + start + ", " + end + ")");
        }
        style = style == null ? "" : style;
        sourceSetId = sourceSetId == null ? "" : sourceSetId;
    }

    /** Span length in UTF-16 code units. */
    public int length() {
        return end - start;
    }

    /**
     * Half-open interval overlap; touching endpoints do not overlap.
     *
     * @param other other match
     * @return {@code true} if the spans share at least one code unit
     */
    public boolean overlaps(Match other) {
        return start < other.end && end > other.start;
    }
}
