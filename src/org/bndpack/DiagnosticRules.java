package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.bndpack.Diagnostic.Kind;
import org.bndpack.Diagnostic.Severity;

/**
 * Decides whether what bnd reports is fatal or advisory. Warnings are always
 * advisory. Errors are fatal unless they match one of the advisory patterns,
 * which cover conditions bnd reports as errors while still being able to
 * calculate the MANIFEST (typically a missing Bundle-Activator). Exceptions are
 * always fatal.
 */
public class DiagnosticRules {
	private final static Logger logger = System.getLogger(DiagnosticRules.class.getName());

	/** Classpath resource listing the default advisory patterns. */
	final static String DEFAULT_RULES = "advisory-errors.txt";

	private final List<Pattern> advisoryErrors;

	public DiagnosticRules(List<Pattern> advisoryErrors) {
		this.advisoryErrors = Collections.unmodifiableList(new ArrayList<>(advisoryErrors));
	}

	/** The rules shipped with bndpack. */
	public static DiagnosticRules defaults() {
		try (InputStream in = DiagnosticRules.class.getResourceAsStream(DEFAULT_RULES)) {
			Objects.requireNonNull(in, DEFAULT_RULES + " not found in classpath");
			return new DiagnosticRules(parse(in));
		} catch (IOException e) {
			throw new IllegalStateException("Cannot load " + DEFAULT_RULES, e);
		}
	}

	/** A copy of these rules with additional advisory patterns. */
	public DiagnosticRules withAdvisory(List<String> regexps) {
		List<Pattern> patterns = new ArrayList<>(advisoryErrors);
		for (String regexp : regexps)
			patterns.add(compile(regexp));
		return new DiagnosticRules(patterns);
	}

	/** Classifies a message as reported by the engine. */
	public Diagnostic classify(Kind kind, String message) {
		Objects.requireNonNull(kind);
		String msg = message != null ? message : "";
		switch (kind) {
		case WARNING:
			return new Diagnostic(Severity.ADVISORY, kind, msg);
		case ERROR:
			for (Pattern pattern : advisoryErrors)
				if (pattern.matcher(msg).find()) {
					logger.log(DEBUG, () -> "Error '" + msg + "' is advisory as per " + pattern);
					return new Diagnostic(Severity.ADVISORY, kind, msg);
				}
			return new Diagnostic(Severity.FATAL, kind, msg);
		default:
			return new Diagnostic(Severity.FATAL, kind, msg);
		}
	}

	/** Whether this error message would be considered advisory. */
	boolean isAdvisoryError(String message) {
		return !classify(Kind.ERROR, message).isFatal();
	}

	List<Pattern> getAdvisoryErrors() {
		return advisoryErrors;
	}

	/** Reads one pattern per line, ignoring blank lines and # comments. */
	static List<Pattern> parse(InputStream in) throws IOException {
		List<Pattern> res = new ArrayList<>();
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		String line;
		while ((line = reader.readLine()) != null) {
			String trimmed = line.strip();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			res.add(compile(trimmed));
		}
		return res;
	}

	private static Pattern compile(String regexp) {
		try {
			return Pattern.compile(regexp);
		} catch (PatternSyntaxException e) {
			throw new IllegalArgumentException("Invalid advisory pattern: " + regexp, e);
		}
	}
}
