package com.openforge.parley.semantic;

/**
 * Best label found by {@link SemanticMatcher#bestLabel}.
 *
 * @param label   the winning label
 * @param example the example phrase that scored highest for it
 * @param score   similarity between the query and {@code example}
 */
public record LabelMatch<L>(L label, String example, double score) {}
