package org.lexidex.core.persistence;

import java.io.IOException;

/**
 * A stored bundle could not be read back as a complete, consistent bundle. Nothing should be served from it.
 */
public class BundleLoadException extends IOException {
	public BundleLoadException(String message) {
		super(message);
	}

	public BundleLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
