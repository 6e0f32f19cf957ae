package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.io.IOException;
import java.lang.System.Logger;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * A single bundle build: resolves the instructions, runs the engine, reports
 * the diagnostics and writes the archive if, and only if, the build succeeded.
 */
public class BundleBuild {
	private final static Logger logger = System.getLogger(BundleBuild.class.getName());

	private final InstructionResolver resolver;
	private final BundleEngine engine;
	private final DiagnosticsReporter reporter;
	private final ArchiveWriter writer;

	public BundleBuild(BundleEngine engine, DiagnosticsReporter reporter) {
		this(new InstructionResolver(), engine, reporter, new ArchiveWriter());
	}

	public BundleBuild(InstructionResolver resolver, BundleEngine engine, DiagnosticsReporter reporter,
			ArchiveWriter writer) {
		this.resolver = Objects.requireNonNull(resolver);
		this.engine = Objects.requireNonNull(engine);
		this.reporter = Objects.requireNonNull(reporter);
		this.writer = Objects.requireNonNull(writer);
	}

	/**
	 * Builds the bundle. Fatal conditions are returned in the result, only host
	 * I/O failures are thrown.
	 */
	public BuildResult build(BuildContext context, Map<String, ?> attributes, InstructionSet instructions)
			throws IOException {
		return build(context, InstructionSet.attributes(attributes), instructions);
	}

	public BuildResult build(BuildContext context, InstructionSet attributes, InstructionSet instructions)
			throws IOException {
		SortedMap<String, String> resolved = resolver.resolve(attributes, instructions);
		if (logger.isLoggable(DEBUG)) {
			logger.log(DEBUG, "Resolved instructions for " + context.getArchiveName() + ":");
			for (Map.Entry<String, String> entry : resolved.entrySet())
				logger.log(DEBUG, entry.getKey() + ": " + entry.getValue());
		}

		final BuildContext effective = InstructionResolver.isSourcesEnabled(resolved)
				? context.withEmbedSources(true)
				: context;

		BuildResult result = engine.build(effective, resolved);
		reporter.report(result);
		if (result.isSuccess()) {
			writer.write(result, effective);
			if (!result.getAdvisories().isEmpty())
				logger.log(WARNING, effective.getArchiveFileName() + " built with " + result.getAdvisories().size()
						+ " advisory diagnostic(s)");
			logger.log(INFO, "Built " + effective.getArchivePath());
		} else {
			logger.log(DEBUG, () -> "Not writing " + effective.getArchivePath() + " since build failed");
		}
		return result;
	}
}
