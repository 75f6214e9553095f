/**
 * Theme model for review annotation: backend theme highlights, their conversion into
 * pattern sets, and the static theme style tables.
 */
package ai.reviewlens.tools.annotator.themes;
