package org.lexidex.indexing.indexer;

import org.lexidex.core.index.IndexBundle;

import java.io.IOException;
import java.nio.file.Path;

public interface BundleWriter {
	/**
	 * Persist the bundle, replacing any previous one
	 *
	 * @return where the bundle was written
	 */
	Path write(IndexBundle bundle) throws IOException;

	/**
	 * Location the next write will replace
	 */
	Path getTarget();

	/**
	 * Get size of the persisted bundle in MB
	 */
	double getSizeInMB();
}
