package org.lexidex.core.index;

/**
 * A build was aborted. No bundle is produced when this is thrown.
 */
public class IndexBuildException extends Exception {
	public IndexBuildException(String message) {
		super(message);
	}

	public IndexBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
