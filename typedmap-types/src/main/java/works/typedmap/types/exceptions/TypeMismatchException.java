package works.typedmap.types.exceptions;

import org.jetbrains.annotations.Nullable;
import works.typedmap.types.Mismatch;
import works.typedmap.types.ValueType;

/**
 * A value does not conform, and no coercion was attempted:
 * either coercion is disallowed where the check happened,
 * or the check is one of the strict ones made by {@link works.typedmap.types.Contracts}.
 */
public final class TypeMismatchException extends TypeCheckException {
	private final Site site;
	private final String name;
	private final transient Mismatch mismatch;

	/**
	 * Where the offending value was found.
	 */
	public enum Site {
		VALUE,
		FIELD,
		ARGUMENT,
		RETURN,
	}

	/**
	 * @param name the field or parameter name; null for {@link Site#VALUE} and {@link Site#RETURN}
	 * @param mismatch the innermost failure, which may point inside {@code actual}
	 */
	public TypeMismatchException(Site site, @Nullable String name, ValueType expected, @Nullable Object actual, Mismatch mismatch) {
		super(fullMessage(site, name, expected, mismatch), expected, actual, null);
		this.site = site;
		this.name = name;
		this.mismatch = mismatch;
	}

	public Site site() {
		return site;
	}

	public @Nullable String name() {
		return name;
	}

	public Mismatch mismatch() {
		return mismatch;
	}

	public boolean isReturnViolation() {
		return site == Site.RETURN;
	}

	private static String fullMessage(Site site, @Nullable String name, ValueType expected, Mismatch mismatch) {
		String subject = switch (site) {
			case VALUE -> "Value";
			case FIELD -> "Field \"" + name + "\"";
			case ARGUMENT -> "Argument \"" + name + "\"";
			case RETURN -> "Return value";
		};
		return subject + " does not conform to " + expected + ": " + mismatch;
	}
}
