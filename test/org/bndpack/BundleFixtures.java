package org.bndpack;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.Manifest;

/** A small compiled project in the org.foo.bar package. */
final class BundleFixtures {
	static final String ACTIVATOR_SOURCE = "package org.foo.bar;\n\npublic class TestActivator {\n"
			+ "\tpublic Object start() {\n\t\treturn new More();\n\t}\n}\n";
	static final String MORE_SOURCE = "package org.foo.bar;\n class More {}";

	final Path projectDir;
	final Path sources;
	final Path resources;
	final Path classes;
	final Path output;

	private BundleFixtures(Path projectDir) {
		this.projectDir = projectDir;
		this.sources = projectDir.resolve(Make.DEFAULT_SOURCES);
		this.resources = projectDir.resolve(Make.DEFAULT_RESOURCES);
		this.classes = projectDir.resolve(Make.DEFAULT_CLASSES);
		this.output = projectDir.resolve(Make.DEFAULT_OUTPUT);
	}

	/** Writes the sources and a resource, without compiling. */
	static BundleFixtures create(Path projectDir) throws IOException {
		BundleFixtures fixtures = new BundleFixtures(projectDir);
		Path javaSrc = Files.createDirectories(fixtures.sources.resolve("org/foo/bar"));
		Files.writeString(javaSrc.resolve("TestActivator.java"), ACTIVATOR_SOURCE);
		Files.writeString(javaSrc.resolve("More.java"), MORE_SOURCE);
		Path res = Files.createDirectories(fixtures.resources.resolve("org/foo/bar"));
		Files.writeString(res.resolve("dummy.txt"), "abc");
		return fixtures;
	}

	/** Writes and compiles the project. */
	static BundleFixtures compiled(Path projectDir) throws IOException {
		BundleFixtures fixtures = create(projectDir);
		PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
		new Make(projectDir, sink, sink).compile(List.of(fixtures.sources), List.of(), fixtures.classes);
		return fixtures;
	}

	BuildContext.Builder context(String name) {
		return BuildContext.builder() //
				.classRoots(List.of(classes)) //
				.resourceRoots(List.of(resources)) //
				.sourceRoots(List.of(sources)) //
				.outputDirectory(output) //
				.archiveName(name);
	}

	static Manifest manifest(BuildResult result) throws IOException {
		return new Manifest(new ByteArrayInputStream(result.getManifest()));
	}

	static String header(BuildResult result, String name) throws IOException {
		return manifest(result).getMainAttributes().getValue(name);
	}
}
