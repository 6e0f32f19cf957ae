package org.bndpack;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarFile;
import java.util.stream.Stream;

import org.bndpack.Diagnostic.Kind;
import org.bndpack.Diagnostic.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveWriterTest {
	@TempDir
	Path tempDir;

	private final ArchiveWriter writer = new ArchiveWriter();

	static BuildResult sample() {
		byte[] manifest = "Manifest-Version: 1.0\r\nBundle-SymbolicName: org.foo.bar\r\nBuilt-By: xyz\r\n\r\n"
				.getBytes(StandardCharsets.UTF_8);
		return new BuildResult(manifest,
				List.of(new ArchiveEntry(BuildResult.MANIFEST_PATH, manifest),
						new ArchiveEntry("org/foo/bar/dummy.txt", "abc".getBytes(StandardCharsets.UTF_8)),
						new ArchiveEntry("OSGI-OPT/src/org/foo/bar/More.java",
								"class More {}".getBytes(StandardCharsets.UTF_8))),
				List.of(), List.of(), List.of());
	}

	@Test
	void writesManifestAndEntries() throws IOException {
		Path jarP = writer.write(sample(), tempDir.resolve("libs/org.foo.bar-1.0.jar"));
		assertTrue(Files.exists(jarP));
		try (JarFile jarFile = new JarFile(jarP.toFile())) {
			assertEquals("xyz", jarFile.getManifest().getMainAttributes().getValue("Built-By"));
			assertNotNull(jarFile.getEntry("OSGI-OPT/src/org/foo/bar/More.java"));
			try (InputStream in = jarFile.getInputStream(jarFile.getEntry("org/foo/bar/dummy.txt"))) {
				assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), in.readAllBytes());
			}
		}
	}

	@Test
	void leavesNoTemporaryFile() throws IOException {
		writer.write(sample(), tempDir.resolve("out.jar"));
		writer.write(sample(), tempDir.resolve("out.jar"));
		try (Stream<Path> files = Files.list(tempDir)) {
			assertEquals(List.of(tempDir.resolve("out.jar")), files.toList());
		}
	}

	@Test
	void refusesFailedBuilds() {
		BuildResult failed = BuildResult.failed(
				List.of(new Diagnostic(Severity.FATAL, Kind.ERROR, "Input file does not exist: missing.txt")),
				List.of(), List.of());
		Path jarP = tempDir.resolve("failed.jar");
		assertThrows(IllegalStateException.class, () -> writer.write(failed, jarP));
		assertFalse(Files.exists(jarP));
	}

	@Test
	void failedWriteLeavesNoTemporaryFile() throws IOException {
		Path occupied = tempDir.resolve("occupied.jar");
		Files.createDirectories(occupied);
		Files.writeString(occupied.resolve("keep.txt"), "keep");
		assertThrows(IOException.class, () -> writer.write(sample(), occupied));
		try (Stream<Path> files = Files.list(tempDir)) {
			assertEquals(List.of(occupied), files.toList());
		}
		assertTrue(Files.isDirectory(occupied));
	}
}
