package works.typedmap.exceptions;

/**
 * A {@link works.typedmap.Schema} was declared in a way that can't work.
 * Raised when the schema is built, or when its declarations are scanned.
 */
public class InvalidDeclarationException extends RuntimeException {
	public InvalidDeclarationException(String message) {
		super(message);
	}

	public InvalidDeclarationException(String message, Throwable cause) {
		super(message, cause);
	}
}
