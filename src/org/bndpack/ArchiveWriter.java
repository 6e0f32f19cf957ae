package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.lang.System.Logger;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import java.util.zip.Deflater;

/**
 * Writes a successful {@link BuildResult} as a jar. The jar is written to a
 * temporary file next to the target, which is then moved in place, so that a
 * partially written archive is never visible.
 */
public class ArchiveWriter {
	private final static Logger logger = System.getLogger(ArchiveWriter.class.getName());

	/** Writes the archive and returns its path. */
	public Path write(BuildResult result, Path jarP) throws IOException {
		if (!result.isSuccess())
			throw new IllegalStateException("Cannot write " + jarP + " from a failed build");
		Path parent = jarP.toAbsolutePath().getParent();
		Files.createDirectories(parent);
		Manifest manifest = new Manifest(new ByteArrayInputStream(result.getManifest()));

		Path tmpP = Files.createTempFile(parent, "." + jarP.getFileName(), ".tmp");
		try {
			try (JarOutputStream jarOut = new JarOutputStream(Files.newOutputStream(tmpP), manifest)) {
				jarOut.setLevel(Deflater.DEFAULT_COMPRESSION);
				for (ArchiveEntry entry : result.getEntries()) {
					if (BuildResult.MANIFEST_PATH.equals(entry.getPath()))
						continue; // already written
					jarOut.putNextEntry(new JarEntry(entry.getPath()));
					jarOut.write(entry.getContent());
					jarOut.closeEntry();
				}
			}
			try {
				Files.move(tmpP, jarP, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				logger.log(WARNING, "Atomic move not supported for " + jarP + ", replacing it");
				Files.move(tmpP, jarP, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(tmpP);
		}
		logger.log(DEBUG, () -> "Wrote " + jarP);
		return jarP;
	}

	/** Writes the archive at the location of this context. */
	public Path write(BuildResult result, BuildContext context) throws IOException {
		return write(result, context.getArchivePath());
	}
}
