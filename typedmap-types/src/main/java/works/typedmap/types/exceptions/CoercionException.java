package works.typedmap.types.exceptions;

import org.jetbrains.annotations.Nullable;
import works.typedmap.types.Mismatch;
import works.typedmap.types.ValueType;

/**
 * The {@link works.typedmap.types.Coercer} found no way to convert a value
 * into a form that conforms to {@link #expected()}.
 */
public final class CoercionException extends TypeCheckException {
	private final String reason;

	public CoercionException(ValueType expected, @Nullable Object value, String reason) {
		this(expected, value, reason, null);
	}

	public CoercionException(ValueType expected, @Nullable Object value, String reason, @Nullable Throwable cause) {
		super("Cannot coerce " + Mismatch.describe(value) + " to " + expected + ": " + reason, expected, value, cause);
		this.reason = reason;
	}

	public String reason() {
		return reason;
	}
}
