package works.typedmap;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typedmap.exceptions.MissingFieldException;
import works.typedmap.exceptions.ReadOnlyMemberException;
import works.typedmap.exceptions.UnknownKeyException;
import works.typedmap.types.Mismatch;
import works.typedmap.types.exceptions.CoercionException;
import works.typedmap.types.exceptions.TypeMismatchException;
import works.typedmap.util.DottedPath;
import works.typedmap.util.JsonShape;

import static java.util.Objects.requireNonNull;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.FIELD;

/**
 * A {@link Map} from strings to values that enforces the declarations of its {@link Schema}.
 * <p>
 * Every write, whether through {@link #put}, {@link Map.Entry#setValue}, an {@link #as attribute view},
 * {@link #setNested}, {@link #merge}, or construction, takes the same path:
 * <ol>
 *     <li>computed members can't be written;</li>
 *     <li>undeclared keys are rejected if the configuration is {@link TypedMapConfig#strict() strict}
 *         and doesn't {@link TypedMapConfig#allowExtra() allow extras};</li>
 *     <li>declared fields are type-checked when {@code strict} or {@link TypedMapConfig#coerce() coerce} is on,
 *         and a mismatch is coerced if {@code coerce} is on;</li>
 *     <li>the value must be JSON-compatible if {@link TypedMapConfig#enforceJson() enforceJson} is on;</li>
 *     <li>the key's checks run in order, each transforming the value;</li>
 *     <li>the value is stored;</li>
 *     <li>cached computed members that depend on the key are invalidated.</li>
 * </ol>
 * A write that fails leaves the map and its caches as they were.
 * <p>
 * Computed members behave as read-only keys: {@link #get} and {@link #containsKey} see them,
 * but they are not part of {@link #entrySet()} or {@link #size()}.
 * <p>
 * Each instance is guarded by its own lock,
 * so the write path is atomic with respect to readers.
 * Iterating over {@link #entrySet()} is not atomic.
 */
public class TypedMap extends AbstractMap<String, Object> {
	private final Schema<?> schema;
	private final Map<String, Object> storage = new LinkedHashMap<>();
	private final ComputedCache cache = new ComputedCache();
	private final Object lock = new Object();

	/**
	 * An empty map using the {@link Schema#generic() generic} schema.
	 */
	public TypedMap() {
		this(Schema.generic(), Map.of(), Map.of());
	}

	/**
	 * A map using the {@link Schema#generic() generic} schema, holding the given entries.
	 * Nested mappings are converted when they are first read.
	 */
	public TypedMap(Map<String, ?> initial) {
		this(Schema.generic(), initial, Map.of());
	}

	protected TypedMap(Schema<?> schema, Map<String, ?> initial) {
		this(schema, initial, Map.of());
	}

	/**
	 * Fills in defaults for any declared fields absent from {@code initial} and {@code overrides},
	 * then runs every value through the write path.
	 * <p>
	 * Checks run before subclass constructors, so they shouldn't rely on subclass instance fields.
	 *
	 * @param overrides take precedence over {@code initial}
	 * @throws MissingFieldException if required fields are absent
	 */
	protected TypedMap(Schema<?> schema, Map<String, ?> initial, Map<String, ?> overrides) {
		if (!schema.type().isInstance(this)) {
			throw new IllegalArgumentException(getClass().getSimpleName() + " cannot use " + schema);
		}
		this.schema = schema;
		Map<String, Object> values = new LinkedHashMap<>(initial);
		values.putAll(overrides);
		List<String> missing = new ArrayList<>();
		for (FieldSpec field : schema.fields().values()) {
			if (!values.containsKey(field.name())) {
				if (field.isRequired()) {
					missing.add(field.name());
				} else {
					values.put(field.name(), field.initialValue());
				}
			}
		}
		if (!missing.isEmpty()) {
			throw new MissingFieldException(schema.type(), missing);
		}
		synchronized (lock) {
			for (Map.Entry<String, Object> entry : values.entrySet()) {
				storage.put(entry.getKey(), prepare(entry.getKey(), entry.getValue()));
			}
		}
	}

	public Schema<?> schema() {
		return schema;
	}

	/*
	 * Write path
	 */

	/**
	 * @return the value that should be stored for {@code key}
	 */
	private Object prepare(String key, @Nullable Object value) {
		requireNonNull(key, "key");
		if (schema.isComputed(key)) {
			throw new ReadOnlyMemberException(schema.type(), key);
		}
		TypedMapConfig config = schema.config();
		FieldSpec field = schema.fields().get(key);
		if (field == null) {
			if (config.strict() && !config.allowExtra()) {
				throw new UnknownKeyException(key, schema.type().getSimpleName() + " has no field \"" + key + "\"");
			}
		} else if (config.strict() || config.coerce()) {
			Optional<Mismatch> mismatch = schema.matcher().check(value, field.type());
			if (mismatch.isPresent()) {
				if (config.coerce()) {
					value = coerce(key, value, field);
				} else {
					throw new TypeMismatchException(FIELD, key, field.type(), value, mismatch.get());
				}
			}
		}
		if (config.enforceJson()) {
			JsonShape.require(value, key);
		}
		for (CheckSpec check : schema.checksFor(key)) {
			value = check.apply(this, value);
		}
		return value;
	}

	private Object coerce(String key, @Nullable Object value, FieldSpec field) {
		try {
			return schema.coercer().coerce(value, field.type());
		} catch (CoercionException e) {
			LOGGER.debug("Unable to coerce field \"{}\" of {}: {}", key, schema.type().getSimpleName(), e.reason());
			throw e;
		}
	}

	@Override
	public Object put(String key, Object value) {
		synchronized (lock) {
			Object prepared = prepare(key, value);
			Object previous = storage.put(key, prepared);
			invalidateDependents(key);
			return previous;
		}
	}

	/**
	 * Each entry is written separately; if one fails, those before it remain written.
	 */
	@Override
	public void putAll(@NotNull Map<? extends String, ?> m) {
		synchronized (lock) {
			m.forEach(this::put);
		}
	}

	@Override
	public Object remove(Object key) {
		synchronized (lock) {
			if (key instanceof String name && schema.isComputed(name)) {
				throw new ReadOnlyMemberException(schema.type(), name);
			}
			if (!storage.containsKey(key)) {
				return null;
			}
			Object previous = storage.remove(key);
			invalidateDependents((String) key);
			return previous;
		}
	}

	@Override
	public void clear() {
		synchronized (lock) {
			storage.clear();
			invalidateAll();
		}
	}

	private void invalidateDependents(String key) {
		Set<String> affected = schema.graph().affectedBy(key);
		if (!affected.isEmpty()) {
			LOGGER.debug("Change to \"{}\" invalidates {}", key, affected);
			affected.forEach(cache::invalidate);
		}
	}

	/*
	 * Read path
	 */

	/**
	 * Follows the {@link Map} contract: returns {@code null} for absent keys.
	 *
	 * @see #require
	 */
	@Override
	public Object get(Object key) {
		synchronized (lock) {
			if (!(key instanceof String name)) {
				return null;
			}
			ComputedSpec computed = schema.computed().get(name);
			if (computed != null) {
				return produce(computed);
			} else if (storage.containsKey(name)) {
				return realize(name, storage.get(name));
			} else {
				return null;
			}
		}
	}

	/**
	 * Like {@link #get}, but fails if the key is absent.
	 *
	 * @throws UnknownKeyException if {@code key} is neither stored nor computed
	 */
	public Object require(String key) {
		synchronized (lock) {
			if (!containsKey(key)) {
				throw new UnknownKeyException(key, schema.type().getSimpleName() + " has no key \"" + key + "\"");
			}
			return get(key);
		}
	}

	/**
	 * @return the value of {@code key}, or {@code null} if it is absent
	 * @throws ClassCastException if the value is not a {@code valueType}
	 */
	public <V> V get(String key, Class<V> valueType) {
		return valueType.cast(get(key));
	}

	private Object produce(ComputedSpec computed) {
		String name = computed.name();
		if (computed.cache() && cache.isValid(name)) {
			return cache.value(name);
		}
		long generation = cache.generation(name);
		Object result = computed.producer().apply(this);
		if (computed.cache() && !cache.store(name, result, generation)) {
			LOGGER.debug("Computed member \"{}\" was invalidated while it was produced; not caching", name);
		}
		return result;
	}

	/**
	 * Converts nested plain containers on first read, and stores the converted form
	 * so later reads return the same object.
	 * The logical value is unchanged, so nothing is invalidated.
	 */
	private Object realize(String key, @Nullable Object value) {
		if (!schema.config().autoConvert()) {
			return value;
		}
		Object converted = Conversions.shallow(value);
		if (converted != value) {
			LOGGER.debug("Converted \"{}\" to {}", key, converted.getClass().getSimpleName());
			storage.put(key, converted);
		}
		return converted;
	}

	@Override
	public boolean containsKey(Object key) {
		synchronized (lock) {
			return storage.containsKey(key)
				|| (key instanceof String name && schema.isComputed(name));
		}
	}

	@Override
	public int size() {
		synchronized (lock) {
			return storage.size();
		}
	}

	@Override
	public @NotNull Set<Entry<String, Object>> entrySet() {
		return new EntrySet();
	}

	/**
	 * A snapshot of the stored entries, without conversion or computed members.
	 */
	Map<String, Object> rawEntries() {
		synchronized (lock) {
			return new LinkedHashMap<>(storage);
		}
	}

	private final class EntrySet extends AbstractSet<Entry<String, Object>> {
		@Override
		public @NotNull Iterator<Entry<String, Object>> iterator() {
			Iterator<String> keys = storage.keySet().iterator();
			return new Iterator<>() {
				String current;

				@Override
				public boolean hasNext() {
					return keys.hasNext();
				}

				@Override
				public Entry<String, Object> next() {
					current = keys.next();
					return new LiveEntry(current);
				}

				@Override
				public void remove() {
					synchronized (lock) {
						keys.remove();
						invalidateDependents(current);
					}
				}
			};
		}

		@Override
		public int size() {
			return TypedMap.this.size();
		}
	}

	/**
	 * Reads and writes go through the map, so they see conversions and run the write path.
	 */
	private final class LiveEntry implements Entry<String, Object> {
		private final String key;

		LiveEntry(String key) {
			this.key = key;
		}

		@Override
		public String getKey() {
			return key;
		}

		@Override
		public Object getValue() {
			return get(key);
		}

		@Override
		public Object setValue(Object value) {
			return put(key, value);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Entry<?, ?> e
				&& key.equals(e.getKey())
				&& Objects.equals(getValue(), e.getValue());
		}

		@Override
		public int hashCode() {
			return key.hashCode() ^ Objects.hashCode(getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}

	/*
	 * Attribute-style access
	 */

	/**
	 * @return a view of this map as {@code viewInterface}, whose getters and setters read and write keys of this map
	 * @throws IllegalArgumentException if {@code viewInterface} has a method that is neither a getter nor a setter
	 */
	public <V> V as(Class<V> viewInterface) {
		return AttributeViews.view(this, viewInterface);
	}

	/*
	 * Nested paths
	 */

	/**
	 * @param dottedPath keys separated by dots; numeric segments also index into lists
	 * @throws UnknownKeyException if any segment of the path is absent
	 * @throws IllegalArgumentException if the path descends into something that is not a mapping or list
	 */
	public Object getNested(String dottedPath) {
		synchronized (lock) {
			List<String> segments = DottedPath.parse(dottedPath);
			Object current = this;
			for (String segment : segments) {
				current = step(current, segment, dottedPath);
			}
			return current;
		}
	}

	private static Object step(Object current, String segment, String dottedPath) {
		if (current instanceof Map<?, ?> map) {
			if (!map.containsKey(segment)) {
				throw new UnknownKeyException(segment, "No key \"" + segment + "\" in path \"" + dottedPath + "\"");
			}
			return map.get(segment);
		} else if (current instanceof List<?> list) {
			int index = DottedPath.indexOf(segment);
			if (index < 0 || index >= list.size()) {
				throw new UnknownKeyException(segment, "No index " + segment + " in path \"" + dottedPath + "\"");
			}
			return list.get(index);
		} else {
			throw new IllegalArgumentException("Cannot look up \"" + segment + "\" in " + Mismatch.describe(current) + " in path \"" + dottedPath + "\"");
		}
	}

	/**
	 * Sets the value at {@code dottedPath}, creating {@link TypedMap}s for absent intermediate keys.
	 * <p>
	 * The containers along the path are copied, not modified in place,
	 * and the updated copy is written to the first key through the usual write path,
	 * so the first key's declared type, the JSON policy, and its checks all apply.
	 * If that write fails, nothing changes.
	 */
	public void setNested(String dottedPath, Object value) {
		synchronized (lock) {
			List<String> segments = DottedPath.parse(dottedPath);
			String key = segments.get(0);
			if (segments.size() == 1) {
				put(key, value);
				return;
			}
			Object root = intermediate(storage.get(key), key, dottedPath);
			put(key, withNested(root, segments.subList(1, segments.size()), value, dottedPath));
		}
	}

	/**
	 * @return a copy of {@code container} with {@code value} at the position named by {@code segments}
	 */
	private static Object withNested(Object container, List<String> segments, @Nullable Object value, String dottedPath) {
		String segment = segments.get(0);
		List<String> rest = segments.subList(1, segments.size());
		if (container instanceof List<?> list) {
			int index = DottedPath.indexOf(segment);
			if (index < 0 || index >= list.size()) {
				throw new UnknownKeyException(segment, "No index " + segment + " in path \"" + dottedPath + "\"");
			}
			List<Object> result = new ArrayList<>(list);
			result.set(index, rest.isEmpty() ? value
				: withNested(intermediate(list.get(index), segment, dottedPath), rest, value, dottedPath));
			return result;
		} else if (container instanceof TypedMap typedMap) {
			TypedMap result = typedMap.copy();
			result.put(segment, rest.isEmpty() ? value
				: withNested(intermediate(typedMap.rawEntries().get(segment), segment, dottedPath), rest, value, dottedPath));
			return result;
		} else if (container instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>(map);
			result.put(segment, rest.isEmpty() ? value
				: withNested(intermediate(map.get(segment), segment, dottedPath), rest, value, dottedPath));
			return result;
		} else {
			throw new IllegalArgumentException("Cannot set \"" + segment + "\" in " + Mismatch.describe(container) + " in path \"" + dottedPath + "\"");
		}
	}

	private static Object intermediate(@Nullable Object next, String segment, String dottedPath) {
		if (next == null) {
			return new TypedMap();
		} else if (next instanceof Map || next instanceof List) {
			return next;
		}
		throw new IllegalArgumentException("Cannot descend into " + Mismatch.describe(next) + " at \"" + segment + "\" in path \"" + dottedPath + "\"");
	}

	/*
	 * Whole-structure operations
	 */

	/**
	 * Deep merge: where both this map and {@code other} hold mappings under the same key,
	 * they are merged recursively; otherwise the value from {@code other} replaces the existing one.
	 * <p>
	 * Merged mappings are built as copies, and each resulting top-level value goes through the write path.
	 * Either every key is written or, if any fails, none are.
	 */
	public void merge(Map<?, ?> other) {
		synchronized (lock) {
			Map<String, Object> prepared = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : other.entrySet()) {
				if (!(entry.getKey() instanceof String key)) {
					throw new IllegalArgumentException("Cannot merge non-string key " + Mismatch.describe(entry.getKey()));
				}
				Object incoming = entry.getValue();
				Object existing = storage.get(key);
				Object value = (incoming instanceof Map<?, ?> incomingMap && existing instanceof Map)
					? merged(existing, incomingMap)
					: incoming;
				prepared.put(key, prepare(key, value));
			}
			prepared.forEach((key, value) -> {
				storage.put(key, value);
				invalidateDependents(key);
			});
		}
	}

	private static Object merged(Object existing, Map<?, ?> incoming) {
		if (existing instanceof TypedMap typedMap) {
			TypedMap result = typedMap.copy();
			result.merge(incoming);
			return result;
		}
		Map<Object, Object> result = new LinkedHashMap<>((Map<?, ?>) existing);
		incoming.forEach((k, v) -> {
			Object current = result.get(k);
			if (v instanceof Map<?, ?> vm && current instanceof Map) {
				result.put(k, merged(current, vm));
			} else {
				result.put(k, v);
			}
		});
		return result;
	}

	/**
	 * Structural equality of the {@link #unconvert unconverted} forms,
	 * so it doesn't matter whether nested mappings have been converted.
	 */
	public boolean deepEquals(@Nullable Object other) {
		return Conversions.deepEquals(this, other);
	}

	/**
	 * Rewrites every mapping with string keys in {@code plain} into a {@link TypedMap},
	 * every list into a fresh {@link java.util.ArrayList}, and every set into a fresh {@link java.util.LinkedHashSet}.
	 */
	public static Object convert(@Nullable Object plain) {
		return Conversions.convert(plain);
	}

	/**
	 * The inverse of {@link #convert}: the result contains only plain containers.
	 * Computed members are omitted.
	 */
	public static Object unconvert(@Nullable Object value) {
		return Conversions.unconvert(value);
	}

	@SuppressWarnings("unchecked")
	public Map<String, Object> toPlainMap() {
		return (Map<String, Object>) unconvert(this);
	}

	/**
	 * A new instance of the same class, created through the schema's constructor,
	 * holding the same stored values.
	 * Nested containers are shared, not copied.
	 * Because construction runs the write path, the checks run again on the copied values.
	 */
	@SuppressWarnings("unchecked")
	public <T extends TypedMap> T copy() {
		return (T) schema.newInstance(rawEntries());
	}

	/**
	 * Runs every stored value through the write path again, and stores the results.
	 * Either all values are replaced or, if any fails, none are.
	 *
	 * @throws MissingFieldException if required fields have been removed
	 */
	public void validate() {
		synchronized (lock) {
			List<String> missing = new ArrayList<>();
			for (FieldSpec field : schema.fields().values()) {
				if (field.isRequired() && !storage.containsKey(field.name())) {
					missing.add(field.name());
				}
			}
			if (!missing.isEmpty()) {
				throw new MissingFieldException(schema.type(), missing);
			}
			Map<String, Object> prepared = new LinkedHashMap<>();
			storage.forEach((k, v) -> prepared.put(k, prepare(k, v)));
			storage.putAll(prepared);
			invalidateAll();
		}
	}

	/*
	 * Cache management
	 */

	/**
	 * Invalidates the given computed members and everything that depends on them.
	 * Useful when a producer reads state from outside the map.
	 */
	public void invalidate(String... computedNames) {
		synchronized (lock) {
			for (String name : computedNames) {
				requireComputed(name);
				cache.invalidate(name);
				invalidateDependents(name);
			}
		}
	}

	public void invalidateAll() {
		synchronized (lock) {
			schema.computed().keySet().forEach(cache::invalidate);
		}
	}

	public CacheState cacheState(String computedName) {
		synchronized (lock) {
			requireComputed(computedName);
			return cache.state(computedName);
		}
	}

	private void requireComputed(String name) {
		if (!schema.isComputed(name)) {
			throw new IllegalArgumentException(schema.type().getSimpleName() + " has no computed member \"" + name + "\"");
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + super.toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypedMap.class);
}
