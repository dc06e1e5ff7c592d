package works.typedmap.exceptions;

import org.jetbrains.annotations.Nullable;
import works.typedmap.types.Mismatch;

public class JsonShapeException extends IllegalArgumentException {
	private final String path;
	private final transient Object offendingValue;

	public JsonShapeException(String path, @Nullable Object offendingValue, String reason) {
		super("Value at " + path + " is not JSON-compatible: " + Mismatch.describe(offendingValue) + " (" + reason + ")");
		this.path = path;
		this.offendingValue = offendingValue;
	}

	/**
	 * @return where the first offending value was found, starting with the key being written
	 */
	public String path() {
		return path;
	}

	public @Nullable Object offendingValue() {
		return offendingValue;
	}
}
