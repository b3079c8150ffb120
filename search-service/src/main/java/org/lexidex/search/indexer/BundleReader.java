package org.lexidex.search.indexer;

import org.lexidex.core.index.IndexBundle;

import java.io.IOException;
import java.nio.file.Path;

public interface BundleReader {
	/**
	 * Load and validate the persisted bundle
	 */
	IndexBundle read() throws IOException;

	/**
	 * Where the bundle is read from
	 */
	Path getSource();

	/**
	 * Get size of the persisted bundle in MB
	 */
	double getSizeInMB();
}
