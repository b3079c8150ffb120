package org.lexidex.search.service;

/**
 * Thrown when a query arrives before any bundle has been loaded.
 */
public class IndexNotLoadedException extends IllegalStateException {
	public IndexNotLoadedException() {
		super("index not loaded");
	}
}
