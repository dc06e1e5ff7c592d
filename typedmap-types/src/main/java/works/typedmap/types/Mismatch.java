package works.typedmap.types;

import org.jetbrains.annotations.Nullable;

/**
 * Explains why a value failed to match: the failing sub-expression,
 * the offending value, and where that value sits inside the value that was checked.
 *
 * @param path a location like {@code $[2].name}, where {@code $} is the value that was checked
 */
public record Mismatch(ValueType expected, @Nullable Object actual, String path, String reason) {
	public static final String ROOT = "$";

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("expected ")
			.append(expected)
			.append(" but got ")
			.append(describe(actual));
		if (!ROOT.equals(path)) {
			sb.append(" at ").append(path);
		}
		if (!reason.isEmpty()) {
			sb.append(" (").append(reason).append(")");
		}
		return sb.toString();
	}

	/**
	 * @return a short human-readable rendering of {@code value} for diagnostics
	 */
	public static String describe(@Nullable Object value) {
		if (value == null) {
			return "null";
		}
		String repr = (value instanceof CharSequence || value instanceof Character)
			? "\"" + value + "\""
			: String.valueOf(value);
		if (repr.length() > MAX_REPR_LENGTH) {
			repr = repr.substring(0, MAX_REPR_LENGTH - 3) + "...";
		}
		return value.getClass().getSimpleName() + " " + repr;
	}

	private static final int MAX_REPR_LENGTH = 60;
}
