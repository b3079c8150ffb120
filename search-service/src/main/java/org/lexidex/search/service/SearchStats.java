package org.lexidex.search.service;

/**
 * @param builtAt ISO-8601 build time of the served bundle, {@code null} when nothing is loaded
 */
public record SearchStats(
		boolean loaded,
		int documentCount,
		int uniqueTerms,
		String builtAt
) {}
