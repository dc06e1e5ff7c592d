package works.typedmap.types;

/**
 * The absent sentinel: only {@code null} conforms.
 */
public record NoneType() implements ValueType {
	@Override
	public boolean acceptsNone() {
		return true;
	}

	@Override
	public String toString() {
		return "None";
	}
}
