package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.PrintStream;
import java.lang.System.Logger;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Surfaces a {@link BuildResult}: diagnostics on the error channel, trace lines
 * (prefixed with <code># </code>) on the trace channel, and the classpath
 * summary on the output channel when verbose. Diagnostics are reported as
 * classified by the engine.
 */
public class DiagnosticsReporter {
	private final static Logger logger = System.getLogger(DiagnosticsReporter.class.getName());

	/** Prefix of trace lines. */
	public final static String TRACE_PREFIX = "# ";
	/** Beginning of the classpath summary. */
	public final static String CLASSPATH_SUMMARY = "The Builder is about to generate a jar using classpath: ";

	private final PrintStream out;
	private final PrintStream err;
	private final PrintStream trace;
	private final boolean verbose;

	/** Trace lines go to the error channel. */
	public DiagnosticsReporter(PrintStream out, PrintStream err, boolean verbose) {
		this(out, err, err, verbose);
	}

	public DiagnosticsReporter(PrintStream out, PrintStream err, PrintStream trace, boolean verbose) {
		this.out = Objects.requireNonNull(out);
		this.err = Objects.requireNonNull(err);
		this.trace = Objects.requireNonNull(trace);
		this.verbose = verbose;
	}

	/** Reports everything relevant from this result. */
	public void report(BuildResult result) {
		classpath(result.getClasspath());
		for (String line : result.getTrace())
			trace.println(TRACE_PREFIX + line);
		for (Diagnostic diagnostic : result.getAdvisories())
			err.println(format(diagnostic));
		for (Diagnostic diagnostic : result.getFatals())
			err.println(format(diagnostic));
		trace.flush();
		err.flush();
	}

	/** The classpath summary line. */
	public void classpath(List<Path> classpath) {
		String summary = CLASSPATH_SUMMARY + classpath;
		logger.log(DEBUG, summary);
		if (verbose) {
			out.println(summary);
			out.flush();
		}
	}

	static String format(Diagnostic diagnostic) {
		if (diagnostic.isFatal())
			return "Error: " + diagnostic.getMessage();
		if (diagnostic.getKind() == Diagnostic.Kind.WARNING)
			return "Warning: " + diagnostic.getMessage();
		return "Error (non fatal): " + diagnostic.getMessage();
	}
}
