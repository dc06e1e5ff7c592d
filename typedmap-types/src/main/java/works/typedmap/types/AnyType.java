package works.typedmap.types;

/**
 * Every value conforms, including {@code null}.
 */
public record AnyType() implements ValueType {
	@Override
	public boolean acceptsNone() {
		return true;
	}

	@Override
	public String toString() {
		return "Any";
	}
}
