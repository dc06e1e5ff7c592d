package works.typedmap;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.typedmap.types.TypeMatcher;

/**
 * Per-type options governing the write path of {@link TypedMap}.
 * Each option can be set independently.
 */
@Value
@Builder(toBuilder = true)
public class TypedMapConfig {
	/**
	 * Type-check writes to declared fields.
	 * Together with {@code allowExtra = false}, also rejects undeclared keys.
	 */
	@Default boolean strict = false;

	/**
	 * Permit keys that aren't declared fields.
	 * Only enforced when {@link #strict} is on.
	 */
	@Default boolean allowExtra = true;

	/**
	 * On a type mismatch in a declared field, attempt coercion before failing.
	 * Turns on the type check even when {@link #strict} is off.
	 */
	@Default boolean coerce = false;

	/**
	 * Every stored value must be JSON-compatible.
	 *
	 * @see works.typedmap.util.JsonShape
	 */
	@Default boolean enforceJson = false;

	/**
	 * Lazily convert nested plain mappings into {@link TypedMap}s when they are read.
	 */
	@Default boolean autoConvert = true;

	@Default TypeMatcher.Settings matcherSettings = TypeMatcher.Settings.DEFAULT;

	public static TypedMapConfig defaults() {
		return DEFAULTS;
	}

	private static final TypedMapConfig DEFAULTS = TypedMapConfig.builder().build();
}
