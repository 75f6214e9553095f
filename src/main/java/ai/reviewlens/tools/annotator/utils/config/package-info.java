/**
 * Utilities for serializing and deserializing the annotator's configuration.
 *
 * <p>Includes JSON mapping helpers ({@link ai.reviewlens.tools.annotator.utils.config.ConfigJsonMapper}),
 * config key constants, and state holders. These classes are pure data/IO helpers and are safe
 * to use from background threads.</p>
 */
package ai.reviewlens.tools.annotator.utils.config;
