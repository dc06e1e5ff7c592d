package works.typedmap;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A computed member: a read-only key whose value comes from {@code producer}.
 *
 * @param cache if false, every read calls the producer
 * @param dependencies the keys {@code producer} reads, in declaration order, without duplicates
 */
public record ComputedSpec(
	String name,
	Function<TypedMap, ?> producer,
	boolean cache,
	List<String> dependencies
) {
	public ComputedSpec {
		requireNonNull(name);
		requireNonNull(producer);
		dependencies = dependencies.stream().distinct().toList();
	}
}
