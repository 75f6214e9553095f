package ai.reviewlens.tools.annotator.themes;

/**
 * One AI-extracted evidence item of a theme.
 *
 * @param content         translated label or phrase as shown in the translated review
 * @param contentOriginal verbatim evidence from the original-language review (nullable)
 */
public record ThemeItem(String content, String contentOriginal) { }
