package ai.reviewlens.tools.annotator.themes;

/**
 * The five preset marketing themes, in display and priority order.
 */
public enum ThemeType {
    WHO("who", "Who", "blue"),
    WHERE("where", "Where", "purple"),
    WHEN("when", "When", "green"),
    WHY("why", "Why", "pink"),
    WHAT("what", "What", "orange");

    private final String id;
    private final String label;
    private final String colorKey;

    ThemeType(String id, String label, String colorKey) {
        this.id = id;
        this.label = label;
        this.colorKey = colorKey;
    }

    /** Wire id used by the backend and as the pattern-set id/style. */
    public String id() { return id; }

    public String label() { return label; }

    /** Key into {@link ThemeStyles}. */
    public String colorKey() { return colorKey; }

    /**
     * Looks up a preset by wire id.
     *
     * @param id theme id (nullable)
     * @return the preset, or {@code null} for custom/unknown ids
     */
    public static ThemeType fromId(String id) {
        if (id == null) return null;
        for (ThemeType t : values()) {
            if (t.id.equals(id)) return t;
        }
        return null;
    }
}
