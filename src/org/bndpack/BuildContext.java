package org.bndpack;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a single bundle build works on: classpath, roots, output location and
 * mode flags. Immutable, created once per build.
 */
public final class BuildContext {
	/** Default archive extension. */
	public final static String DEFAULT_EXTENSION = "jar";

	private final List<Path> classpath;
	private final List<Path> classRoots;
	private final List<Path> resourceRoots;
	private final List<Path> sourceRoots;
	private final Path outputDirectory;
	private final String archiveName;
	private final String version;
	private final String extension;
	private final boolean embedSources;
	private final boolean trace;

	private BuildContext(Builder builder) {
		this.classpath = copy(builder.classpath);
		this.classRoots = copy(builder.classRoots);
		this.resourceRoots = copy(builder.resourceRoots);
		this.sourceRoots = copy(builder.sourceRoots);
		this.outputDirectory = Objects.requireNonNull(builder.outputDirectory, "Output directory must be set")
				.toAbsolutePath().normalize();
		this.archiveName = Objects.requireNonNull(builder.archiveName, "Archive name must be set");
		if (archiveName.isBlank())
			throw new IllegalArgumentException("Archive name cannot be blank");
		this.version = builder.version;
		this.extension = builder.extension != null ? builder.extension : DEFAULT_EXTENSION;
		this.embedSources = builder.embedSources;
		this.trace = builder.trace;
	}

	/** Archive entries and dependencies bnd analyses against. */
	public List<Path> getClasspath() {
		return classpath;
	}

	/** Directories containing the compiled classes to package. */
	public List<Path> getClassRoots() {
		return classRoots;
	}

	/** Directories containing the resources to package. */
	public List<Path> getResourceRoots() {
		return resourceRoots;
	}

	/** Directories containing the Java sources. */
	public List<Path> getSourceRoots() {
		return sourceRoots;
	}

	public Path getOutputDirectory() {
		return outputDirectory;
	}

	public String getArchiveName() {
		return archiveName;
	}

	/** May be <code>null</code>. */
	public String getVersion() {
		return version;
	}

	public String getExtension() {
		return extension;
	}

	public boolean isEmbedSources() {
		return embedSources;
	}

	public boolean isTrace() {
		return trace;
	}

	/** File name of the archive, e.g. <code>name-1.0.2.jar</code>. */
	public String getArchiveFileName() {
		StringBuilder sb = new StringBuilder(archiveName);
		if (version != null && !version.isBlank())
			sb.append('-').append(version);
		if (!extension.isEmpty())
			sb.append('.').append(extension);
		return sb.toString();
	}

	/** Location of the archive to produce. */
	public Path getArchivePath() {
		return outputDirectory.resolve(getArchiveFileName());
	}

	/** A copy of this context with the embed sources flag set. */
	public BuildContext withEmbedSources(boolean embedSources) {
		if (this.embedSources == embedSources)
			return this;
		Builder builder = toBuilder();
		builder.embedSources = embedSources;
		return builder.build();
	}

	Builder toBuilder() {
		Builder builder = new Builder();
		builder.classpath.addAll(classpath);
		builder.classRoots.addAll(classRoots);
		builder.resourceRoots.addAll(resourceRoots);
		builder.sourceRoots.addAll(sourceRoots);
		builder.outputDirectory = outputDirectory;
		builder.archiveName = archiveName;
		builder.version = version;
		builder.extension = extension;
		builder.embedSources = embedSources;
		builder.trace = trace;
		return builder;
	}

	public static Builder builder() {
		return new Builder();
	}

	private static List<Path> copy(List<Path> paths) {
		List<Path> res = new ArrayList<>();
		for (Path p : paths)
			res.add(Objects.requireNonNull(p, "Paths cannot contain null").toAbsolutePath().normalize());
		return Collections.unmodifiableList(res);
	}

	@Override
	public String toString() {
		return "BuildContext[" + getArchivePath() + ", classRoots=" + classRoots + ", resourceRoots=" + resourceRoots
				+ ", sourceRoots=" + sourceRoots + ", classpath=" + classpath + ", embedSources=" + embedSources
				+ ", trace=" + trace + "]";
	}

	/** Collects the collaborator inputs of a {@link BuildContext}. */
	public static class Builder {
		private final List<Path> classpath = new ArrayList<>();
		private final List<Path> classRoots = new ArrayList<>();
		private final List<Path> resourceRoots = new ArrayList<>();
		private final List<Path> sourceRoots = new ArrayList<>();
		private Path outputDirectory;
		private String archiveName;
		private String version;
		private String extension;
		private boolean embedSources = false;
		private boolean trace = false;

		private Builder() {
		}

		public Builder classpath(List<Path> entries) {
			classpath.addAll(entries);
			return this;
		}

		public Builder classRoots(List<Path> roots) {
			classRoots.addAll(roots);
			return this;
		}

		public Builder resourceRoots(List<Path> roots) {
			resourceRoots.addAll(roots);
			return this;
		}

		public Builder sourceRoots(List<Path> roots) {
			sourceRoots.addAll(roots);
			return this;
		}

		public Builder outputDirectory(Path outputDirectory) {
			this.outputDirectory = outputDirectory;
			return this;
		}

		public Builder archiveName(String archiveName) {
			this.archiveName = archiveName;
			return this;
		}

		public Builder version(String version) {
			this.version = version;
			return this;
		}

		public Builder extension(String extension) {
			this.extension = extension;
			return this;
		}

		public Builder embedSources(boolean embedSources) {
			this.embedSources = embedSources;
			return this;
		}

		public Builder trace(boolean trace) {
			this.trace = trace;
			return this;
		}

		public BuildContext build() {
			return new BuildContext(this);
		}
	}
}
