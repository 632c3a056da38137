package org.crossword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {

	@TempDir
	Path dir;

	private String structure;
	private String words;

	@BeforeEach
	public void writeInputs() throws IOException {
		structure = Files.writeString(dir.resolve("structure.txt"), "___\n##_\n##_\n").toString();
		words = Files.writeString(dir.resolve("words.txt"), "cat\ndog\nten\nnet\n").toString();
	}

	@Test
	public void testDefaults() {
		Main.SolverConfiguration config = new Main.ArgumentParser().parse(new String[] { "-s", structure, "-w", words });

		assertEquals(structure, config.structurePath);
		assertEquals(words, config.wordsPath);
		assertEquals(10, config.timeoutSeconds);
		assertFalse(config.useInference);
		assertNull(config.imagePath);
		assertNull(config.outputPath);
	}

	@Test
	public void testAllOptions() {
		String output = dir.resolve("out").toString();
		Main.SolverConfiguration config = new Main.ArgumentParser().parse(new String[] {
				"-s", structure, "-w", words, "-i", "grid.png", "-o", output, "-t", "3", "-opt=m" });

		assertEquals("grid.png", config.imagePath);
		assertEquals(output, config.outputPath);
		assertEquals(3, config.timeoutSeconds);
		assertTrue(config.useInference);
		assertTrue(Files.isDirectory(dir.resolve("out")));
	}

	@Test
	public void testInvalidArguments() {
		Main.ArgumentParser parser = new Main.ArgumentParser();

		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", structure }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-w", words }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", "missing.txt", "-w", words }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", structure, "-w", words, "-t", "0" }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", structure, "-w", words, "-t", "abc" }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", structure, "-w", words, "-opt=x" }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s", structure, "-w", words, "-i", "grid.jpg" }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-x" }));
		assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[] { "-s" }));
	}

	@Test
	public void testHelpReturnsNoConfiguration() {
		assertNull(new Main.ArgumentParser().parse(new String[] { "-h" }));
	}

	@Test
	public void testPipelineWritesResultFiles() throws IOException {
		Path output = dir.resolve("results");
		Main.SolverConfiguration config = new Main.ArgumentParser().parse(new String[] {
				"-s", structure, "-w", words, "-o", output.toString() });

		Main.processPuzzle(config);

		Path result = output.resolve("RESULT").resolve("structure.result");
		assertTrue(Files.exists(result));
		assertTrue(Files.exists(output.resolve("STATS").resolve("structure.stats")));

		String content = Files.readString(result, StandardCharsets.UTF_8);
		assertTrue(content.startsWith("SAT"));
		assertTrue(content.contains("██"));
	}

	@Test
	public void testPipelineSavesImage() throws IOException {
		Path image = dir.resolve("grid.png");
		Main.SolverConfiguration config = new Main.ArgumentParser().parse(new String[] {
				"-s", structure, "-w", words, "-i", image.toString() });

		Main.processPuzzle(config);

		BufferedImage saved = ImageIO.read(image.toFile());
		assertNotNull(saved);
		assertEquals(300, saved.getWidth());
		assertEquals(300, saved.getHeight());
	}

	@Test
	public void testTimeoutWritesOnlyResultFile() throws IOException {
		Random random = new Random(42);
		StringBuilder vocabulary = new StringBuilder();
		for (int n = 0; n < 3000; n++) {
			for (int k = 0; k < 7; k++) {
				vocabulary.append((char) ('A' + random.nextInt(26)));
			}
			vocabulary.append('\n');
		}
		String openGrid = "_______\n".repeat(7);
		String hardStructure = Files.writeString(dir.resolve("open.txt"), openGrid).toString();
		String hardWords = Files.writeString(dir.resolve("random.txt"), vocabulary).toString();
		Path output = dir.resolve("results");

		Main.SolverConfiguration config = new Main.ArgumentParser().parse(new String[] {
				"-s", hardStructure, "-w", hardWords, "-o", output.toString(), "-t", "1" });
		Main.processPuzzle(config);

		Path result = output.resolve("RESULT").resolve("open.result");
		assertTrue(Files.readString(result, StandardCharsets.UTF_8).startsWith("TIMEOUT"));
		assertFalse(Files.exists(output.resolve("STATS").resolve("open.stats")));
	}
}
