package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.TRACE;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.jar.Manifest;

import org.bndpack.Diagnostic.Kind;

import aQute.bnd.osgi.Builder;
import aQute.bnd.osgi.FileResource;
import aQute.bnd.osgi.Jar;
import aQute.bnd.osgi.Resource;

/**
 * {@link BundleEngine} based on the bnd {@link Builder}. A new builder is used
 * for each build. The archive is first seeded with the class and resource
 * roots, then bnd calculates the MANIFEST and adds what the instructions
 * require (e.g. sources with <code>-sources: true</code>).
 */
public class BndBundleEngine implements BundleEngine {
	private final static Logger logger = System.getLogger(BndBundleEngine.class.getName());

	/** Prefix of embedded sources within the archive. */
	public final static String OSGI_OPT_SRC = "OSGI-OPT/src/";

	private final DiagnosticRules rules;

	public BndBundleEngine() {
		this(DiagnosticRules.defaults());
	}

	public BndBundleEngine(DiagnosticRules rules) {
		this.rules = Objects.requireNonNull(rules);
	}

	@Override
	public BuildResult build(BuildContext context, Map<String, String> instructions) throws IOException {
		Objects.requireNonNull(context);
		Objects.requireNonNull(instructions);
		List<String> trace = new ArrayList<>();
		Consumer<String> tracer = context.isTrace() ? trace::add : (line) -> {
		};

		checkRoots(existing(context.getClassRoots()));
		checkRoots(existing(context.getResourceRoots()));

		List<Path> classpath = new ArrayList<>();
		for (Path root : context.getClassRoots())
			if (Files.exists(root))
				classpath.add(root);
		classpath.addAll(context.getClasspath());

		List<Diagnostic> diagnostics = new ArrayList<>();
		List<Jar> roots = new ArrayList<>();
		try (Builder builder = new Builder()) {
			tracer.accept("build");
			builder.setTrace(context.isTrace());
			Files.createDirectories(context.getOutputDirectory());
			builder.setBase(context.getOutputDirectory().toFile());

			Properties properties = new Properties();
			properties.putAll(instructions);
			builder.setProperties(properties);

			tracer.accept("classpath " + classpath);
			builder.setClasspath(toFiles(classpath));
			if (context.isEmbedSources()) {
				tracer.accept("sourcepath " + context.getSourceRoots());
				builder.setSourcepath(toFiles(existing(context.getSourceRoots())));
			}

			// seed the archive, classes first
			Jar dot = new Jar(context.getArchiveName());
			for (Path root : existing(context.getClassRoots()))
				addRoot(dot, root, roots, tracer);
			for (Path root : existing(context.getResourceRoots()))
				addRoot(dot, root, roots, tracer);
			builder.setJar(dot);

			Jar jar;
			try {
				jar = builder.build();
			} catch (IOException e) {
				throw e;
			} catch (Exception e) {
				logger.log(ERROR, "bnd build of " + context.getArchiveName() + " failed", e);
				diagnostics.add(rules.classify(Kind.EXCEPTION, "bnd build failed: " + e));
				jar = null;
			}

			for (String warning : builder.getWarnings())
				diagnostics.add(rules.classify(Kind.WARNING, warning));
			for (String error : builder.getErrors())
				diagnostics.add(rules.classify(Kind.ERROR, error));

			if (jar == null) {
				if (diagnostics.stream().noneMatch(Diagnostic::isFatal))
					diagnostics.add(rules.classify(Kind.EXCEPTION, "bnd did not produce any archive"));
				return BuildResult.failed(diagnostics, trace, classpath);
			}
			if (diagnostics.stream().anyMatch(Diagnostic::isFatal))
				return BuildResult.failed(diagnostics, trace, classpath);

			if (context.isEmbedSources())
				addSources(jar, existing(context.getSourceRoots()), tracer);

			// load everything before the builder and the jars are closed
			byte[] manifest = toBytes(jar.getManifest());
			List<ArchiveEntry> entries = new ArrayList<>();
			entries.add(new ArchiveEntry(BuildResult.MANIFEST_PATH, manifest));
			for (Map.Entry<String, Resource> entry : jar.getResources().entrySet()) {
				String path = entry.getKey();
				if (BuildResult.MANIFEST_PATH.equals(path))
					continue;
				entries.add(new ArchiveEntry(path, read(entry.getValue(), path)));
			}
			logger.log(DEBUG, () -> context.getArchiveName() + ": " + entries.size() + " entries, "
					+ diagnostics.size() + " diagnostics");
			return new BuildResult(manifest, entries, diagnostics, trace, classpath);
		} catch (IOException e) {
			throw e;
		} catch (Exception e) {
			// manifest calculation or resource access
			logger.log(ERROR, "bnd processing of " + context.getArchiveName() + " failed", e);
			diagnostics.add(rules.classify(Kind.EXCEPTION, "bnd processing failed: " + e));
			return BuildResult.failed(diagnostics, trace, classpath);
		} finally {
			for (Jar root : roots)
				root.close();
		}
	}

	/** Adds all the files of this directory to the archive. */
	void addRoot(Jar dot, Path root, List<Jar> roots, Consumer<String> tracer) throws IOException {
		Jar rootJar = new Jar(root.toFile());
		roots.add(rootJar);
		dot.addAll(rootJar);
		tracer.accept("added " + rootJar.getResources().size() + " resources from " + root);
	}

	/**
	 * Makes sure that each file of the source roots is under
	 * {@value #OSGI_OPT_SRC}, whether bnd added it or not.
	 */
	void addSources(Jar jar, List<Path> sourceRoots, Consumer<String> tracer) throws IOException {
		for (Path srcP : sourceRoots) {
			Files.walkFileTree(srcP, new SimpleFileVisitor<Path>() {
				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
					String path = OSGI_OPT_SRC + toEntryPath(srcP.relativize(file));
					if (jar.getResource(path) == null) {
						jar.putResource(path, new FileResource(file.toFile()));
						logger.log(TRACE, () -> "Added source " + path);
					}
					return FileVisitResult.CONTINUE;
				}
			});
			tracer.accept("sources from " + srcP);
		}
	}

	/*
	 * UTILITIES
	 */
	static String toEntryPath(Path relative) {
		return relative.toString().replace(File.separatorChar, '/');
	}

	/** Class and resource roots must be readable directories. */
	static void checkRoots(List<Path> roots) throws IOException {
		for (Path root : roots) {
			if (!Files.isDirectory(root))
				throw new NotDirectoryException(root.toString());
			if (!Files.isReadable(root))
				throw new AccessDeniedException(root.toString(), null, "Cannot read root");
		}
	}

	static List<Path> existing(List<Path> paths) {
		List<Path> res = new ArrayList<>();
		for (Path p : paths) {
			if (Files.exists(p))
				res.add(p);
			else
				logger.log(DEBUG, () -> p + " does not exist, skipping...");
		}
		return res;
	}

	static File[] toFiles(List<Path> paths) {
		File[] res = new File[paths.size()];
		for (int i = 0; i < res.length; i++)
			res[i] = paths.get(i).toFile();
		return res;
	}

	static byte[] toBytes(Manifest manifest) throws IOException {
		if (manifest == null)
			throw new IllegalStateException("bnd did not calculate any MANIFEST");
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		manifest.write(out);
		return out.toByteArray();
	}

	static byte[] read(Resource resource, String path) throws Exception {
		try (InputStream in = resource.openInputStream()) {
			if (in == null)
				throw new IOException("Cannot read " + path);
			return in.readAllBytes();
		}
	}
}
