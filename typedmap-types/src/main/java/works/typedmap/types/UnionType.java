package works.typedmap.types;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Conforms if any alternative conforms.
 * The order of {@link #alternatives} doesn't affect matching,
 * but the {@link Coercer} tries them in this order.
 * <p>
 * Nested unions are flattened and duplicates removed,
 * so structurally equivalent unions are {@link Object#equals equal}.
 */
public record UnionType(List<ValueType> alternatives) implements ValueType {
	public UnionType {
		alternatives = List.copyOf(flatten(alternatives));
		if (alternatives.isEmpty()) {
			throw new IllegalArgumentException("Union must have at least one alternative");
		}
	}

	/**
	 * @return true if this is {@code optional(inner)} for some single inner type.
	 */
	public boolean isOptional() {
		return alternatives.size() == 2 && alternatives.get(1) instanceof NoneType;
	}

	@Override
	public boolean acceptsNone() {
		return alternatives.stream().anyMatch(ValueType::acceptsNone);
	}

	@Override
	public String toString() {
		if (isOptional()) {
			return "Optional[" + alternatives.get(0) + "]";
		} else {
			return "Union[" + alternatives.stream()
				.map(ValueType::toString)
				.collect(joining(", "))
				+ "]";
		}
	}

	private static List<ValueType> flatten(List<? extends ValueType> alternatives) {
		List<ValueType> result = new ArrayList<>();
		for (ValueType alternative : alternatives) {
			List<ValueType> members = (alternative instanceof UnionType u)
				? u.alternatives()
				: List.of(alternative);
			for (ValueType member : members) {
				if (!result.contains(member)) {
					result.add(member);
				}
			}
		}
		return result;
	}
}
