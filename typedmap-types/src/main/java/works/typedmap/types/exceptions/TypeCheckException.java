package works.typedmap.types.exceptions;

import org.jetbrains.annotations.Nullable;
import works.typedmap.types.ValueType;

/**
 * A value does not conform to a {@link ValueType}.
 */
public sealed abstract class TypeCheckException extends RuntimeException permits CoercionException, TypeMismatchException {
	private final transient ValueType expected;
	private final transient Object actual;

	protected TypeCheckException(String message, ValueType expected, @Nullable Object actual, @Nullable Throwable cause) {
		super(message, cause);
		this.expected = expected;
		this.actual = actual;
	}

	public ValueType expected() {
		return expected;
	}

	public @Nullable Object actual() {
		return actual;
	}
}
