/**
 * Built-in pattern-set catalogs shipped as a classpath resource.
 */
package ai.reviewlens.tools.annotator.presets;
