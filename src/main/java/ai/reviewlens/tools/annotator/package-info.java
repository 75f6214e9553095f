/**
 * Root package for the review annotator.
 *
 * <p>Hosts the {@link ai.reviewlens.tools.annotator.Annotator} entry point that chains
 * matching, overlap resolution and run assembly from
 * {@link ai.reviewlens.tools.annotator.text}. Theme and preset helpers that produce pattern
 * sets live in subpackages.</p>
 */
package ai.reviewlens.tools.annotator;
