package works.typedmap.exceptions;

import java.util.NoSuchElementException;

/**
 * A key-style read found no such key, or a write named a key that the
 * declaring type doesn't allow.
 */
public class UnknownKeyException extends NoSuchElementException {
	private final String key;

	public UnknownKeyException(String key, String message) {
		super(message);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
