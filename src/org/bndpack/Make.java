package org.bndpack;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.eclipse.jdt.core.compiler.CompilationProgress;

import aQute.bnd.osgi.Constants;

/**
 * Command line compiler and OSGi packager. It depends on the Eclipse batch
 * compiler (aka. ECJ) and on the BND Libs library for OSGi metadata generation
 * (which itself depends on SLF4J).<br/>
 * <br/>
 * For example, a typical system call would be:<br/>
 * <code>java -cp "/path/to/bndpack jar:/path/to/ECJ jar:/path/to/bndlib jar:/path/to/SLF4J jars" org.bndpack.Make all --name org.foo.bar --version 1.0.2 --instruction Bundle-Activator=org.foo.bar.TestActivator --trace</code>
 * <br/>
 * Paths are relative to the execution directory and default to the usual
 * Maven/Gradle layout.
 */
public class Make {
	private final static Logger logger = System.getLogger(Make.class.getName());

	/** Default source root. */
	final static String DEFAULT_SOURCES = "src/main/java";
	/** Default resource root. */
	final static String DEFAULT_RESOURCES = "src/main/resources";
	/** Default output of the compilation. */
	final static String DEFAULT_CLASSES = "build/classes/java/main";
	/** Default directory for the archives. */
	final static String DEFAULT_OUTPUT = "build/libs";
	/** Java release targeted by the compilation. */
	final static String JAVA_RELEASE = "17";

	/** The execution directory (${user.dir}), against which paths are resolved. */
	final Path execDirectory;
	/** Standard output channel. */
	final PrintStream out;
	/** Error diagnostics channel. */
	final PrintStream err;

	public Make(Path execDirectory, PrintStream out, PrintStream err) {
		this.execDirectory = Objects.requireNonNull(execDirectory).toAbsolutePath().normalize();
		this.out = Objects.requireNonNull(out);
		this.err = Objects.requireNonNull(err);
	}

	/*
	 * ACTIONS
	 */
	/** Compile and create the bundle in one go. */
	BuildResult all(Map<String, List<String>> options) throws IOException {
		compile(options);
		return bundle(options);
	}

	/** Compile the source roots into the first class root. */
	void compile(Map<String, List<String>> options) throws IOException {
		List<Path> sourceRoots = BndBundleEngine.existing(paths(options, "--sources", DEFAULT_SOURCES));
		if (sourceRoots.isEmpty()) {
			logger.log(WARNING, "No sources to compile in " + execDirectory);
			return;
		}
		Path classes = paths(options, "--classes", DEFAULT_CLASSES).get(0);
		List<Path> classpath = paths(options, "--classpath", null);
		compile(sourceRoots, classpath, classes);
	}

	/** Compile these source roots with ECJ. */
	void compile(List<Path> sourceRoots, List<Path> classpath, Path classes) throws IOException {
		Files.createDirectories(classes);
		List<String> compilerArgs = new ArrayList<>();
		compilerArgs.add("-source");
		compilerArgs.add(JAVA_RELEASE);
		compilerArgs.add("-target");
		compilerArgs.add(JAVA_RELEASE);
		compilerArgs.add("-encoding");
		compilerArgs.add("UTF-8");
		compilerArgs.add("-nowarn");

		// classpath
		if (!classpath.isEmpty()) {
			StringJoiner classPath = new StringJoiner(File.pathSeparator);
			for (Path entry : classpath)
				classPath.add(entry.toString());
			compilerArgs.add("-cp");
			compilerArgs.add(classPath.toString());
		}

		compilerArgs.add("-d");
		compilerArgs.add(classes.toString());

		// sources
		for (Path sourceRoot : sourceRoots)
			compilerArgs.add(sourceRoot.toString());

		if (logger.isLoggable(INFO))
			compilerArgs.add("-time");

		if (logger.isLoggable(DEBUG)) {
			logger.log(DEBUG, "Compiler arguments:");
			for (String arg : compilerArgs)
				logger.log(DEBUG, arg);
		}

		boolean success = org.eclipse.jdt.core.compiler.batch.BatchCompiler.compile(
				compilerArgs.toArray(new String[compilerArgs.size()]), new PrintWriter(out), new PrintWriter(err),
				new MakeCompilationProgress(out));
		if (!success)
			throw new IllegalStateException("Compilation failed");
	}

	/** Package the bundle. */
	BuildResult bundle(Map<String, List<String>> options) throws IOException {
		String name = single(options, "--name", execDirectory.getFileName().toString());
		String version = single(options, "--version", null);
		boolean trace = options.containsKey("--trace");
		boolean verbose = options.containsKey("--verbose") || logger.isLoggable(DEBUG);

		BuildContext context = BuildContext.builder() //
				.classpath(paths(options, "--classpath", null)) //
				.classRoots(paths(options, "--classes", DEFAULT_CLASSES)) //
				.resourceRoots(paths(options, "--resources", DEFAULT_RESOURCES)) //
				.sourceRoots(paths(options, "--sources", DEFAULT_SOURCES)) //
				.outputDirectory(paths(options, "--output", DEFAULT_OUTPUT).get(0)) //
				.archiveName(name) //
				.version(version) //
				.extension(single(options, "--extension", BuildContext.DEFAULT_EXTENSION)) //
				.trace(trace) //
				.build();

		// MANIFEST attributes, first value wins
		InstructionSet attributes = InstructionSet.attributes();
		for (Path manifestP : paths(options, "--manifest", null))
			attributes.addInstructions(readManifestAttributes(manifestP));
		for (String keyValue : options.getOrDefault("--attribute", new ArrayList<>()))
			putKeyValue(attributes, keyValue);
		// defaults provided by the project
		attributes.put(Constants.BUNDLE_SYMBOLICNAME, name);
		if (version != null)
			attributes.put(Constants.BUNDLE_VERSION, version);

		// explicit instructions, accumulated
		InstructionSet instructions = InstructionSet.explicit();
		for (Path bndP : paths(options, "--bnd", null))
			instructions.addInstructions(readBndFile(bndP));
		for (String keyValue : options.getOrDefault("--instruction", new ArrayList<>()))
			putKeyValue(instructions, keyValue);

		DiagnosticRules rules = DiagnosticRules.defaults()
				.withAdvisory(options.getOrDefault("--advisory", new ArrayList<>()));
		DiagnosticsReporter reporter = new DiagnosticsReporter(out, err, verbose);
		BundleBuild bundleBuild = new BundleBuild(new BndBundleEngine(rules), reporter);

		long begin = System.currentTimeMillis();
		BuildResult result = bundleBuild.build(context, attributes, instructions);
		if (!result.isSuccess())
			throw new IllegalStateException("Packaging of " + context.getArchiveFileName() + " failed: "
					+ result.getFatals().get(0).getMessage());
		long duration = System.currentTimeMillis() - begin;
		logger.log(INFO, "Packaging took " + duration + " ms");
		return result;
	}

	/*
	 * UTILITIES
	 */
	/** Paths of this option, resolved against the execution directory. */
	List<Path> paths(Map<String, List<String>> options, String option, String defaultValue) {
		List<String> values = options.get(option);
		if (values == null || values.isEmpty())
			values = defaultValue != null ? List.of(defaultValue) : new ArrayList<>();
		List<Path> res = new ArrayList<>();
		for (String value : values)
			res.add(execDirectory.resolve(value));
		return res;
	}

	/** The single value of this option. */
	static String single(Map<String, List<String>> options, String option, String defaultValue) {
		List<String> values = options.get(option);
		if (values == null || values.isEmpty())
			return defaultValue;
		if (values.size() != 1)
			throw new IllegalArgumentException("One and only one " + option + " must be specified");
		return values.get(0);
	}

	/** Adds a <code>key=value</code> argument. */
	static void putKeyValue(InstructionSet instructions, String keyValue) {
		int index = keyValue.indexOf('=');
		if (index <= 0)
			throw new IllegalArgumentException("Expected key=value, got " + keyValue);
		instructions.put(keyValue.substring(0, index).strip(), keyValue.substring(index + 1));
	}

	/** Reads a bnd file, with keys sorted for predictability. */
	static Map<String, String> readBndFile(Path bndP) throws IOException {
		Properties properties = new Properties();
		try (InputStream in = Files.newInputStream(bndP)) {
			properties.load(in);
		}
		Map<String, String> res = new TreeMap<>();
		for (String key : properties.stringPropertyNames())
			res.put(key, properties.getProperty(key));
		return res;
	}

	/** Reads the main attributes of a MANIFEST file. */
	static Map<String, String> readManifestAttributes(Path manifestP) throws IOException {
		Manifest manifest;
		try (InputStream in = Files.newInputStream(manifestP)) {
			manifest = new Manifest(in);
		}
		Map<String, String> res = new TreeMap<>();
		for (Map.Entry<Object, Object> entry : manifest.getMainAttributes().entrySet()) {
			if (Attributes.Name.MANIFEST_VERSION.equals(entry.getKey()))
				continue;
			res.put(entry.getKey().toString(), entry.getValue().toString());
		}
		return res;
	}

	/** Parses the options following the action. */
	static Map<String, List<String>> parseOptions(String... args) {
		int actionIndex = 0;
		String action = args[actionIndex];
		if (args.length > actionIndex + 1 && !args[actionIndex + 1].startsWith("--"))
			throw new IllegalArgumentException(
					"Action " + action + " must be followed by an option: " + Arrays.asList(args));

		Map<String, List<String>> options = new HashMap<>();
		String currentOption = null;
		for (int i = actionIndex + 1; i < args.length; i++) {
			if (args[i].startsWith("--")) {
				currentOption = args[i];
				if (!options.containsKey(currentOption))
					options.put(currentOption, new ArrayList<>());
			} else {
				options.get(currentOption).add(args[i]);
			}
		}
		return options;
	}

	/** Runs an action and returns the exit status. */
	static int run(Path execDirectory, PrintStream out, PrintStream err, String... args) {
		if (args.length == 0) {
			err.println("Usage: compile|bundle|all --option1 argument1 argument2 --option2 argument3");
			return 1;
		}
		String action = args[0];
		try {
			Map<String, List<String>> options = parseOptions(args);
			Make make = new Make(execDirectory, out, err);
			switch (action) {
			case "compile" -> make.compile(options);
			case "bundle" -> make.bundle(options);
			case "all" -> make.all(options);

			default -> throw new IllegalArgumentException("Unknown action: " + action);
			}

			long jvmUptime = ManagementFactory.getRuntimeMXBean().getUptime();
			logger.log(INFO, "Make action '" + action + "' successfully completed after " + (jvmUptime / 1000) + "."
					+ (jvmUptime % 1000) + " s");
			return 0;
		} catch (Exception e) {
			long jvmUptime = ManagementFactory.getRuntimeMXBean().getUptime();
			logger.log(ERROR, "Make action '" + action + "' failed after " + (jvmUptime / 1000) + "."
					+ (jvmUptime % 1000) + " s", e);
			err.println("Make action '" + action + "' failed: " + e.getMessage());
			err.flush();
			return 1;
		}
	}

	/** Main entry point, interpreting actions and arguments. */
	public static void main(String... args) {
		int status = run(Paths.get(System.getProperty("user.dir")), System.out, System.err, args);
		if (status != 0)
			System.exit(status);
	}

	/**
	 * An ECJ {@link CompilationProgress} printing a progress bar while compiling.
	 */
	static class MakeCompilationProgress extends CompilationProgress {
		private final PrintStream out;
		private int totalWork;
		private long currentChunk = 0;
		private long chunksCount = 80;

		MakeCompilationProgress(PrintStream out) {
			this.out = out;
		}

		@Override
		public void worked(int workIncrement, int remainingWork) {
			if (!logger.isLoggable(Level.INFO) || totalWork == 0) // progress bar only at INFO level
				return;
			long chunk = ((totalWork - remainingWork) * chunksCount) / totalWork;
			if (chunk != currentChunk) {
				currentChunk = chunk;
				for (long i = 0; i < currentChunk; i++) {
					out.print("#");
				}
				for (long i = currentChunk; i < chunksCount; i++) {
					out.print("-");
				}
				out.print("\r");
			}
			if (remainingWork == 0)
				out.print("\n");
		}

		@Override
		public void setTaskName(String name) {
		}

		@Override
		public boolean isCanceled() {
			return false;
		}

		@Override
		public void done() {
		}

		@Override
		public void begin(int remainingWork) {
			this.totalWork = remainingWork;
		}
	}
}
