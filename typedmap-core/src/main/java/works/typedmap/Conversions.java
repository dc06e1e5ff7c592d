package works.typedmap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites nested structures between plain {@link java.util} containers and {@link TypedMap}s.
 */
final class Conversions {
	private Conversions() { }

	/**
	 * Mappings with string keys become generic {@link TypedMap}s, all the way down.
	 * Other mappings, lists, and sets are copied with their contents converted.
	 * A {@link TypedMap} is returned as-is.
	 */
	static Object convert(@Nullable Object value) {
		if (value instanceof TypedMap) {
			return value;
		} else if (value instanceof Map<?, ?> map) {
			Map<Object, Object> converted = new LinkedHashMap<>();
			map.forEach((k, v) -> converted.put(k, convert(v)));
			return hasStringKeys(converted) ? new TypedMap(stringKeyed(converted)) : converted;
		} else if (value instanceof List<?> list) {
			List<Object> converted = new ArrayList<>(list.size());
			list.forEach(e -> converted.add(convert(e)));
			return converted;
		} else if (value instanceof Set<?> set) {
			Set<Object> converted = new LinkedHashSet<>();
			set.forEach(e -> converted.add(convert(e)));
			return converted;
		} else {
			return value;
		}
	}

	/**
	 * The inverse of {@link #convert}: the result contains no {@link TypedMap}s.
	 * Computed members are not included.
	 */
	static Object unconvert(@Nullable Object value) {
		if (value instanceof TypedMap typedMap) {
			Map<String, Object> result = new LinkedHashMap<>();
			typedMap.rawEntries().forEach((k, v) -> result.put(k, unconvert(v)));
			return result;
		} else if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(k, unconvert(v)));
			return result;
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			list.forEach(e -> result.add(unconvert(e)));
			return result;
		} else if (value instanceof Set<?> set) {
			Set<Object> result = new LinkedHashSet<>();
			set.forEach(e -> result.add(unconvert(e)));
			return result;
		} else {
			return value;
		}
	}

	/**
	 * Converts one level, for lazy conversion on read:
	 * a plain mapping with string keys becomes a {@link TypedMap} whose own values are left alone,
	 * and a list has its elements converted the same way.
	 *
	 * @return {@code value} itself if there is nothing to convert
	 */
	static Object shallow(@Nullable Object value) {
		if (value instanceof TypedMap) {
			return value;
		} else if (value instanceof Map<?, ?> map) {
			return hasStringKeys(map) ? new TypedMap(stringKeyed(map)) : value;
		} else if (value instanceof List<?> list) {
			List<Object> converted = null;
			for (int i = 0; i < list.size(); i++) {
				Object element = list.get(i);
				Object convertedElement = shallow(element);
				if (convertedElement != element && converted == null) {
					converted = new ArrayList<>(list.subList(0, i));
				}
				if (converted != null) {
					converted.add(convertedElement);
				}
			}
			return converted == null ? value : converted;
		} else {
			return value;
		}
	}

	static boolean deepEquals(@Nullable Object a, @Nullable Object b) {
		return Objects.equals(unconvert(a), unconvert(b));
	}

	private static boolean hasStringKeys(Map<?, ?> map) {
		return map.keySet().stream().allMatch(k -> k instanceof String);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> stringKeyed(Map<?, ?> map) {
		return (Map<String, ?>) map;
	}
}
