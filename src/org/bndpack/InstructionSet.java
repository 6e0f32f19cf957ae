package org.bndpack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Ordered bnd instructions, each key holding the fragments added to it. Keys
 * starting with <code>-</code> are bnd directives (e.g. <code>-sources</code>),
 * the others are MANIFEST headers. Unknown keys are kept as they are: it is up
 * to bnd to ignore them.
 * 
 * @see #explicit()
 * @see #attributes()
 */
public class InstructionSet {
	/** Separator used when flattening fragments. */
	final static String SEPARATOR = ",";

	/** Fragments per key, in insertion order. */
	private final Map<String, List<String>> fragments = new LinkedHashMap<>();
	/**
	 * Whether a {@link #put(String, Object)} appends (explicit instructions) or
	 * is ignored when the key is already set (MANIFEST attributes).
	 */
	private final boolean accumulate;

	private InstructionSet(boolean accumulate) {
		this.accumulate = accumulate;
	}

	/** Layer of explicit bundle instructions, repeated keys accumulate. */
	public static InstructionSet explicit() {
		return new InstructionSet(true);
	}

	/** Layer of MANIFEST attributes, the first value of a key wins. */
	public static InstructionSet attributes() {
		return new InstructionSet(false);
	}

	/** An attribute layer initialised from a plain header map. */
	public static InstructionSet attributes(Map<String, ?> headers) {
		InstructionSet res = attributes();
		if (headers != null)
			res.addInstructions(headers);
		return res;
	}

	/**
	 * Adds a value. A <code>null</code> value is stored as an empty fragment,
	 * which is legal (e.g. a directive without payload).
	 */
	public InstructionSet put(String key, Object value) {
		checkKey(key);
		String fragment = value != null ? value.toString() : "";
		List<String> current = fragments.get(key);
		if (current == null) {
			current = new ArrayList<>();
			fragments.put(key, current);
		} else if (!accumulate) {
			return this;
		}
		current.add(fragment);
		return this;
	}

	/** Performs one {@link #put(String, Object)} per entry. */
	public InstructionSet addInstructions(Map<String, ?> instructions) {
		Objects.requireNonNull(instructions, "Instructions cannot be null");
		for (Map.Entry<String, ?> entry : instructions.entrySet())
			put(entry.getKey(), entry.getValue());
		return this;
	}

	/**
	 * Adds each value as a separate fragment under the same key, so that
	 * <code>("Built-By", "ab", "c")</code> then
	 * <code>("Built-By", "x", "y", "z")</code> flattens to
	 * <code>ab,c,x,y,z</code>.
	 */
	public InstructionSet addInstructionFragments(String key, Object... values) {
		checkKey(key);
		if (values == null || values.length == 0) {
			put(key, "");
			return this;
		}
		for (Object value : values)
			put(key, value);
		return this;
	}

	/** Same as {@link #addInstructionFragments(String, Object...)}. */
	public InstructionSet addInstructionFragments(String key, List<?> values) {
		Objects.requireNonNull(values, "Fragments cannot be null");
		return addInstructionFragments(key, values.toArray());
	}

	/** Fragments of this key, empty if not set. */
	public List<String> getFragments(String key) {
		List<String> current = fragments.get(key);
		return current != null ? Collections.unmodifiableList(current) : Collections.emptyList();
	}

	/** Whether this key has been set. */
	public boolean containsKey(String key) {
		return fragments.containsKey(key);
	}

	/** Keys, in insertion order. */
	public Set<String> keySet() {
		return Collections.unmodifiableSet(fragments.keySet());
	}

	public boolean isEmpty() {
		return fragments.isEmpty();
	}

	boolean isAccumulating() {
		return accumulate;
	}

	/** Each key with its fragments joined with a comma, in insertion order. */
	public Map<String, String> flatten() {
		Map<String, String> res = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : fragments.entrySet()) {
			StringJoiner sj = new StringJoiner(SEPARATOR);
			for (String fragment : entry.getValue())
				sj.add(fragment);
			res.put(entry.getKey(), sj.toString());
		}
		return res;
	}

	/**
	 * Merges two layers key by key: a key present in the instruction layer takes
	 * its value from it, whatever the attribute layer holds. Values are never
	 * accumulated across layers. Neither input is modified.
	 */
	public static InstructionSet merge(InstructionSet attributeLayer, InstructionSet instructionLayer) {
		InstructionSet res = explicit();
		if (attributeLayer != null)
			for (Map.Entry<String, List<String>> entry : attributeLayer.fragments.entrySet()) {
				if (instructionLayer != null && instructionLayer.containsKey(entry.getKey()))
					continue;
				res.fragments.put(entry.getKey(), new ArrayList<>(entry.getValue()));
			}
		if (instructionLayer != null)
			for (Map.Entry<String, List<String>> entry : instructionLayer.fragments.entrySet())
				res.fragments.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		return res;
	}

	private static void checkKey(String key) {
		if (key == null || key.isBlank())
			throw new IllegalArgumentException("Instruction key cannot be null or blank");
	}

	@Override
	public String toString() {
		return (accumulate ? "instructions" : "attributes") + flatten();
	}
}
