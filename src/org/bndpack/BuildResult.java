package org.bndpack;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a bundle build: the MANIFEST, the archive entries (MANIFEST
 * first), the classified diagnostics and the trace lines. A result without any
 * fatal diagnostic is successful.
 */
public final class BuildResult {
	/** Path of the MANIFEST within the archive. */
	public final static String MANIFEST_PATH = "META-INF/MANIFEST.MF";

	private final byte[] manifest;
	private final List<ArchiveEntry> entries;
	private final List<Diagnostic> advisories;
	private final List<Diagnostic> fatals;
	private final List<String> trace;
	private final List<Path> classpath;

	public BuildResult(byte[] manifest, List<ArchiveEntry> entries, List<Diagnostic> diagnostics, List<String> trace,
			List<Path> classpath) {
		this.manifest = manifest != null ? manifest.clone() : null;
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
		List<Diagnostic> advisories = new ArrayList<>();
		List<Diagnostic> fatals = new ArrayList<>();
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.isFatal())
				fatals.add(diagnostic);
			else
				advisories.add(diagnostic);
		}
		this.advisories = Collections.unmodifiableList(advisories);
		this.fatals = Collections.unmodifiableList(fatals);
		this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
		this.classpath = Collections.unmodifiableList(new ArrayList<>(classpath));
		if (this.fatals.isEmpty() && this.manifest == null)
			throw new IllegalArgumentException("A successful build must have a MANIFEST");
	}

	/** A failed result, carrying only diagnostics and trace. */
	public static BuildResult failed(List<Diagnostic> diagnostics, List<String> trace, List<Path> classpath) {
		List<Diagnostic> all = new ArrayList<>(diagnostics);
		if (all.stream().noneMatch(Diagnostic::isFatal))
			throw new IllegalArgumentException("A failed build must have at least one fatal diagnostic");
		return new BuildResult(null, Collections.emptyList(), all, trace, classpath);
	}

	public boolean isSuccess() {
		return fatals.isEmpty();
	}

	/** MANIFEST bytes, <code>null</code> if the build failed. */
	public byte[] getManifest() {
		return manifest != null ? manifest.clone() : null;
	}

	public List<ArchiveEntry> getEntries() {
		return entries;
	}

	public ArchiveEntry getEntry(String path) {
		Objects.requireNonNull(path);
		for (ArchiveEntry entry : entries)
			if (entry.getPath().equals(path))
				return entry;
		return null;
	}

	public List<Diagnostic> getAdvisories() {
		return advisories;
	}

	public List<Diagnostic> getFatals() {
		return fatals;
	}

	/** All diagnostics, advisories first. */
	public List<Diagnostic> getDiagnostics() {
		List<Diagnostic> res = new ArrayList<>(advisories);
		res.addAll(fatals);
		return res;
	}

	/** Raw trace lines, empty if trace was not enabled. */
	public List<String> getTrace() {
		return trace;
	}

	/** Classpath the engine actually analysed against. */
	public List<Path> getClasspath() {
		return classpath;
	}
}
