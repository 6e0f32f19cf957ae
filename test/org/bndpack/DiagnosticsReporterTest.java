package org.bndpack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;

import org.bndpack.Diagnostic.Kind;
import org.bndpack.Diagnostic.Severity;
import org.junit.jupiter.api.Test;

class DiagnosticsReporterTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private DiagnosticsReporter reporter(boolean verbose) {
		return new DiagnosticsReporter(new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8), verbose);
	}

	private static BuildResult result(List<Diagnostic> diagnostics, List<String> trace) {
		byte[] manifest = "Manifest-Version: 1.0\r\n\r\n".getBytes(StandardCharsets.UTF_8);
		return new BuildResult(manifest, List.of(new ArchiveEntry(BuildResult.MANIFEST_PATH, manifest)), diagnostics,
				trace, List.of(Paths.get("/tmp/classes")));
	}

	@Test
	void tracesArePrefixed() {
		reporter(false).report(result(List.of(), List.of("build", "classpath []")));
		String stderr = err.toString(StandardCharsets.UTF_8);
		assertTrue(Pattern.compile("(?m)^# build$").matcher(stderr).find(), stderr);
		assertTrue(stderr.contains("# classpath []"));
	}

	@Test
	void reportsEveryDiagnosticAsClassified() {
		Diagnostic activator = new Diagnostic(Severity.ADVISORY, Kind.ERROR,
				"Bundle-Activator not found on the bundle class path nor in imports: org.foo.bar.NotExistingActivator");
		Diagnostic warning = new Diagnostic(Severity.ADVISORY, Kind.WARNING, "The JAR is empty");
		reporter(false).report(result(List.of(activator, warning), List.of()));
		String stderr = err.toString(StandardCharsets.UTF_8);
		assertTrue(stderr.contains("Error (non fatal): Bundle-Activator not found"), stderr);
		assertTrue(stderr.contains("Warning: The JAR is empty"), stderr);
		assertFalse(stderr.contains("# "));
	}

	@Test
	void reportsFatalDiagnostics() {
		Diagnostic fatal = new Diagnostic(Severity.FATAL, Kind.ERROR, "Input file does not exist: missing.txt");
		reporter(false).report(BuildResult.failed(List.of(fatal), List.of(), List.of()));
		assertEquals("Error: Input file does not exist: missing.txt", err.toString(StandardCharsets.UTF_8).strip());
	}

	@Test
	void classpathSummaryOnlyWhenVerbose() {
		reporter(false).report(result(List.of(), List.of()));
		assertEquals("", out.toString(StandardCharsets.UTF_8));

		reporter(true).report(result(List.of(), List.of()));
		String stdout = out.toString(StandardCharsets.UTF_8);
		assertTrue(Pattern.compile("The Builder is about to generate a jar using classpath: \\[.+\\]").matcher(stdout)
				.find(), stdout);
	}
}
