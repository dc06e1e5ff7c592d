package works.typedmap.types;

import static java.util.Objects.requireNonNull;

/**
 * A scalar kind. Booleans, integers, floats and strings are disjoint:
 * in particular, a boolean never conforms to {@link Kind#INTEGER}
 * unless {@link TypeMatcher.Settings#booleansAsIntegers} says otherwise.
 */
public record PrimitiveType(Kind kind) implements ValueType {
	public PrimitiveType {
		requireNonNull(kind);
	}

	public enum Kind {
		BOOLEAN("Boolean"),
		INTEGER("Integer"),
		FLOAT("Float"),
		STRING("String");

		private final String displayName;

		Kind(String displayName) {
			this.displayName = displayName;
		}
	}

	@Override
	public boolean acceptsNone() {
		return false;
	}

	@Override
	public String toString() {
		return kind.displayName;
	}
}
