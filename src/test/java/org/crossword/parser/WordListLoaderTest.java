package org.crossword.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class WordListLoaderTest {

	@Test
	public void testNormalization() {
		assertEquals(List.of("CAT", "DOG", "NET"),
				List.copyOf(WordListLoader.normalize(List.of("dog", " Cat ", "", "NET", "cat", "   "))));
	}

	@Test
	public void testLoadFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("words.txt");
		Files.writeString(file, "one\ntwo\nthree\n\nTwo\n");

		assertEquals(List.of("ONE", "THREE", "TWO"), List.copyOf(WordListLoader.load(file)));
	}
}
