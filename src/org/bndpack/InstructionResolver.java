package org.bndpack;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import aQute.bnd.osgi.Constants;
import aQute.bnd.osgi.Processor;

/**
 * Resolves MANIFEST attributes and explicit bundle instructions into the
 * properties passed to bnd. Explicit instructions always win over attributes
 * with the same key. Resolution has no side effect and does not depend on the
 * iteration order of its inputs: the result is sorted by key.
 */
public class InstructionResolver {
	/** Prefix of the directives enabling source embedding. */
	final static String SOURCES_DIRECTIVE = Constants.SOURCES;

	public SortedMap<String, String> resolve(Map<String, ?> attributes, InstructionSet instructions) {
		return resolve(InstructionSet.attributes(attributes), instructions);
	}

	public SortedMap<String, String> resolve(InstructionSet attributes, InstructionSet instructions) {
		InstructionSet merged = InstructionSet.merge(attributes, instructions);
		return new TreeMap<>(merged.flatten());
	}

	/**
	 * Whether the resolved instructions ask for the sources to be embedded, that
	 * is whether a key starting with <code>-sources</code> has a value bnd
	 * considers true.
	 */
	public static boolean isSourcesEnabled(Map<String, String> resolved) {
		for (Map.Entry<String, String> entry : resolved.entrySet())
			if (entry.getKey().startsWith(SOURCES_DIRECTIVE) && Processor.isTrue(entry.getValue()))
				return true;
		return false;
	}
}
