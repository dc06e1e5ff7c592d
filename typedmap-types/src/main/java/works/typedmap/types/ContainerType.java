package works.typedmap.types;

import static java.util.Objects.requireNonNull;
import static works.typedmap.types.ValueType.ANY;

/**
 * A parametrized container.
 * <p>
 * {@code keyType} is meaningful only for {@link Kind#MAPPING};
 * for the other kinds it is always {@link ValueType#ANY}.
 */
public record ContainerType(Kind kind, ValueType elementType, ValueType keyType) implements ValueType {
	public ContainerType {
		requireNonNull(kind);
		requireNonNull(elementType);
		requireNonNull(keyType);
		if (kind != Kind.MAPPING) {
			keyType = ANY;
		}
	}

	public enum Kind {
		/**
		 * Ordered and index-addressable: a {@link java.util.List}.
		 */
		SEQUENCE,

		/**
		 * De-duplicated: a {@link java.util.Set}.
		 */
		SET,

		/**
		 * Keyed: a {@link java.util.Map}.
		 */
		MAPPING,
	}

	@Override
	public boolean acceptsNone() {
		return false;
	}

	@Override
	public String toString() {
		return switch (kind) {
			case SEQUENCE -> "Sequence[" + elementType + "]";
			case SET -> "Set[" + elementType + "]";
			case MAPPING -> "Mapping[" + keyType + ", " + elementType + "]";
		};
	}
}
