/**
 * Pure annotation engine: literal phrase search, overlap resolution and run assembly.
 *
 * <ul>
 *   <li>{@code PatternSet}, {@code Match}, {@code Run} – immutable value types</li>
 *   <li>{@code PhraseMatcher} / {@code PhraseAutomaton} – find every occurrence of every phrase</li>
 *   <li>{@code OverlapResolver} – start, then longest, then first-declared wins</li>
 *   <li>{@code SegmentBuilder} – plain/annotated runs that reproduce the text exactly</li>
 * </ul>
 *
 * <p>All offsets are UTF-16 code unit indices. These classes are stateless and thread-safe.</p>
 */
package ai.reviewlens.tools.annotator.text;
