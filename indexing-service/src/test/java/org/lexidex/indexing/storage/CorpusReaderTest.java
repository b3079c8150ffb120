package org.lexidex.indexing.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lexidex.core.model.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CorpusReaderTest {

	@TempDir
	Path tempDir;

	@Test
	public void testFilesAreNumberedInNameOrder() throws IOException {
		Files.writeString(tempDir.resolve("zeta.txt"), "last");
		Files.writeString(tempDir.resolve("alpha.txt"), "first");
		Files.writeString(tempDir.resolve("Beta.TXT"), "upper case extension");
		Files.writeString(tempDir.resolve("readme.md"), "not a document");
		Files.createDirectories(tempDir.resolve("nested.txt"));

		List<Document> documents = new CorpusReader(tempDir.toString(), ".txt", 50).readAll();

		assertEquals(3, documents.size());
		assertEquals(List.of(1, 2, 3), documents.stream().map(Document::id).toList());
		assertEquals(List.of("Beta.TXT", "alpha.txt", "zeta.txt"),
				documents.stream().map(d -> d.metadata().title()).toList());
		assertEquals("first", documents.get(1).rawText());
		assertEquals(tempDir.resolve("alpha.txt").toString(), documents.get(1).metadata().path());
	}

	@Test
	public void testSnippetCollapsesWhitespace() throws IOException {
		Files.writeString(tempDir.resolve("doc.txt"), "  Line one\n\n\tline   two  ");

		Document document = new CorpusReader(tempDir.toString(), ".txt", 12).readAll().get(0);

		assertEquals("Line one lin", document.metadata().snippet());
		assertEquals("Line one line two", CorpusReader.snippet("Line one\nline two", 100));
		assertEquals("", CorpusReader.snippet("   ", 10));
	}

	@Test
	public void testMalformedBytesAreReplaced() throws IOException {
		Files.write(tempDir.resolve("bad.txt"), new byte[]{'o', 'k', ' ', (byte) 0xC3, (byte) 0x28, ' ', 'x'});

		Document document = new CorpusReader(tempDir.toString(), ".txt", 50).readAll().get(0);

		assertTrue(document.rawText().startsWith("ok "));
		assertTrue(document.rawText().endsWith(" x"));
	}

	@Test
	public void testMissingDirectory() {
		CorpusReader reader = new CorpusReader(tempDir.resolve("nope").toString(), ".txt", 10);

		assertThrows(IOException.class, reader::readAll);
	}

	@Test
	public void testNegativeSnippetLength() {
		assertThrows(IllegalArgumentException.class, () -> new CorpusReader(tempDir.toString(), ".txt", -1));
	}
}
