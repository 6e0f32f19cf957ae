package org.bndpack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

class InstructionResolverTest {
	private final InstructionResolver resolver = new InstructionResolver();

	@Test
	void explicitInstructionOverridesAttribute() {
		SortedMap<String, String> resolved = resolver.resolve(Map.of("Built-By", "abc"),
				InstructionSet.explicit().put("Built-By", "xyz"));
		assertEquals("xyz", resolved.get("Built-By"));
	}

	@Test
	void sharedKeyAlwaysTakesFlattenedInstructions() {
		Map<String, String> attributes = Map.of("Bundle-Version", "1.0.2", "Built-By", "abc");
		InstructionSet instructions = InstructionSet.explicit().put("Bundle-Version", "5.0")
				.addInstructionFragments("Built-By", "ab", "c");
		SortedMap<String, String> resolved = resolver.resolve(attributes, instructions);
		for (String key : attributes.keySet())
			assertEquals(instructions.flatten().get(key), resolved.get(key));
	}

	@Test
	void attributeWithoutInstructionPassesThrough() {
		SortedMap<String, String> resolved = resolver.resolve(Map.of("Built-By", "abc", "Bundle-Name", "Foo"),
				InstructionSet.explicit().put("Built-By", "xyz"));
		assertEquals("Foo", resolved.get("Bundle-Name"));
	}

	@Test
	void unknownKeysAreKept() {
		SortedMap<String, String> resolved = resolver.resolve(Map.of(),
				InstructionSet.explicit().put("junk", "xyz"));
		assertEquals("xyz", resolved.get("junk"));
	}

	@Test
	void emptyLayersDegenerateToTheOther() {
		assertEquals(Map.of("A", "1"), resolver.resolve(Map.of("A", "1"), InstructionSet.explicit()));
		assertEquals(Map.of("B", "2"), resolver.resolve((Map<String, ?>) null, InstructionSet.explicit().put("B", "2")));
		assertTrue(resolver.resolve(Map.of(), null).isEmpty());
	}

	@Test
	void resolutionIsDeterministicAndOrderIndependent() {
		Map<String, String> ordered = new LinkedHashMap<>();
		ordered.put("Z-Header", "z");
		ordered.put("A-Header", "a");
		ordered.put("Built-By", "abc");
		Map<String, String> sorted = new TreeMap<>(ordered);
		Map<String, String> hashed = new HashMap<>(ordered);
		InstructionSet instructions = InstructionSet.explicit().put("Built-By", "xyz").put("-sources", "true");

		SortedMap<String, String> first = resolver.resolve(ordered, instructions);
		assertEquals(first, resolver.resolve(ordered, instructions));
		assertEquals(first.toString(), resolver.resolve(sorted, instructions).toString());
		assertEquals(first.toString(), resolver.resolve(hashed, instructions).toString());
		assertEquals("xyz", instructions.flatten().get("Built-By"));
	}

	@Test
	void sourcesDirectiveFollowsBndTruthiness() {
		assertTrue(InstructionResolver.isSourcesEnabled(Map.of("-sources", "true")));
		assertFalse(InstructionResolver.isSourcesEnabled(Map.of("-sources", "false")));
		assertFalse(InstructionResolver.isSourcesEnabled(Map.of("Bundle-Version", "true")));
		assertFalse(InstructionResolver.isSourcesEnabled(Map.of()));
	}
}
