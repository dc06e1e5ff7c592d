package works.typedmap;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Per-instance cached values of computed members.
 * Not thread-safe; the owning {@link TypedMap} holds its lock while calling this.
 */
final class ComputedCache {
	private final Map<String, Slot> slots = new HashMap<>();

	private static final class Slot {
		CacheState state = CacheState.UNCOMPUTED;
		Object value;

		/**
		 * Incremented by every invalidation, so a production that raced
		 * with an invalidation doesn't store a stale value.
		 */
		long generation;
	}

	CacheState state(String name) {
		Slot slot = slots.get(name);
		return slot == null ? CacheState.UNCOMPUTED : slot.state;
	}

	boolean isValid(String name) {
		return state(name) == CacheState.CACHED;
	}

	@Nullable Object value(String name) {
		Slot slot = slots.get(name);
		return slot == null ? null : slot.value;
	}

	long generation(String name) {
		Slot slot = slots.get(name);
		return slot == null ? 0 : slot.generation;
	}

	/**
	 * @return false if {@code name} was invalidated since {@code generation} was read, in which case nothing is stored
	 */
	boolean store(String name, @Nullable Object value, long generation) {
		Slot slot = slots.computeIfAbsent(name, n -> new Slot());
		if (slot.generation != generation) {
			return false;
		}
		slot.state = CacheState.CACHED;
		slot.value = value;
		return true;
	}

	void invalidate(String name) {
		Slot slot = slots.get(name);
		if (slot == null) {
			// Nothing cached, but a production may be in progress
			slot = new Slot();
			slots.put(name, slot);
		}
		if (slot.state == CacheState.CACHED) {
			slot.state = CacheState.INVALID;
			slot.value = null;
		}
		slot.generation++;
	}
}
