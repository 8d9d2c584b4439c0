package org.ansimark.markup.config;

import org.ansimark.markup.flags.AnsiFlag;
import org.ansimark.markup.flags.Flag;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The closed set of values a styler can be configured with. A list of specs is flattened once,
 * at construction, into {@link StyleTables}.
 */
public sealed interface StyleSpec permits StyleSpec.Single, StyleSpec.Combination, StyleSpec.Named, StyleSpec.Sequence {

	/**
	 * One named flag, contributing one positional style.
	 * @param flag The flag.
	 */
	record Single(Flag flag) implements StyleSpec {}

	/**
	 * A bitwise OR of flags, contributing one positional style.
	 * @param value The flag combination.
	 */
	record Combination(long value) implements StyleSpec {}

	/**
	 * Always-styles. Each key is a group of equivalent phrase texts sharing one combination;
	 * later entries overwrite earlier ones for the same text.
	 * @param entries The text groups and their combinations, in insertion order.
	 */
	record Named(Map<List<String>, Long> entries) implements StyleSpec {
		public Named {
			entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
		}
	}

	/**
	 * A nested sequence of specs, flattened in order.
	 * @param elements The nested specs.
	 */
	record Sequence(List<StyleSpec> elements) implements StyleSpec {
		public Sequence {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * @param flag A standard flag.
	 * @return A positional spec for the flag alone.
	 */
	static StyleSpec flag(AnsiFlag flag) {
		return new Single(flag.toFlag());
	}

	/**
	 * @param flags Standard flags.
	 * @return A positional spec combining all given flags.
	 */
	static StyleSpec combine(AnsiFlag... flags) {
		long value = 0;
		for (AnsiFlag flag : flags) {
			value |= flag.bit();
		}
		return new Combination(value);
	}

	/**
	 * @param style The combination to apply.
	 * @param texts The phrase texts that always get this style.
	 * @return An always-style spec.
	 */
	static StyleSpec always(long style, String... texts) {
		return new Named(Map.of(Arrays.asList(texts), style));
	}

	/**
	 * @param elements Nested specs.
	 * @return A sequence spec.
	 */
	static StyleSpec sequence(StyleSpec... elements) {
		return new Sequence(Arrays.asList(elements));
	}
}
