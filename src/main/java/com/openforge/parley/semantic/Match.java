package com.openforge.parley.semantic;

/**
 * One scored candidate.
 *
 * @param text  the candidate text
 * @param index position of the candidate in the list that was searched
 * @param score cosine similarity clamped to [0, 1]
 */
public record Match(String text, int index, double score) {}
