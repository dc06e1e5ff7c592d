package works.typedmap;

import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/**
 * Runs on every write to {@code key}, after type enforcement and before storage.
 * Receives the instance and the candidate value, and returns the value to store.
 */
public record CheckSpec(String key, BiFunction<TypedMap, Object, Object> check) {
	public CheckSpec {
		requireNonNull(key);
		requireNonNull(check);
	}

	Object apply(TypedMap instance, Object value) {
		return check.apply(instance, value);
	}
}
