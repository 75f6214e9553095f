/**
 * Common utilities shared across the annotator.
 *
 * <p>Includes logging ({@link ai.reviewlens.tools.annotator.utils.Logger}) and the version
 * accessor. These classes have no UI dependencies and may be used from any thread.</p>
 */
package ai.reviewlens.tools.annotator.utils;
