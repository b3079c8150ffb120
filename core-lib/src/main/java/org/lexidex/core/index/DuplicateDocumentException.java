package org.lexidex.core.index;

/**
 * Indicates the corpus handed to the builder contains the same document id twice.
 */
public class DuplicateDocumentException extends IndexBuildException {
	private final int documentId;

	public DuplicateDocumentException(int documentId) {
		super("Duplicate document id " + documentId + " in corpus");
		this.documentId = documentId;
	}

	public int getDocumentId() {
		return documentId;
	}
}
