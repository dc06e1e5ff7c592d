package works.typedmap;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typedmap.exceptions.DependencyCycleException;
import works.typedmap.exceptions.InvalidDeclarationException;
import works.typedmap.types.Coercer;
import works.typedmap.types.TypeMatcher;
import works.typedmap.types.ValueType;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The declarations shared by every instance of one {@link TypedMap} subclass:
 * fields, computed members, checks, and configuration.
 * Immutable once {@link Builder#build() built}.
 * <p>
 * Typical usage is a static constant in the declaring class:
 * <pre>
 * public class Person extends TypedMap {
 *     static final Schema&lt;Person&gt; SCHEMA = Schema.builder(Person.class, Person::new)
 *         .field("name", STRING)
 *         .field("age", INTEGER, 0)
 *         .build();
 *
 *     public Person(Map&lt;String, ?&gt; fields) {
 *         super(SCHEMA, fields);
 *     }
 * }
 * </pre>
 */
public final class Schema<T extends TypedMap> {
	private final Class<T> type;
	private final Function<? super Map<String, Object>, ? extends T> constructor;
	private final TypedMapConfig config;
	private final Map<String, FieldSpec> fields;
	private final Map<String, ComputedSpec> computed;
	private final Map<String, List<CheckSpec>> checks;
	private final DependencyGraph graph;
	private final TypeMatcher matcher;
	private final Coercer coercer;

	private Schema(Builder<T> builder) {
		this.type = builder.type;
		this.constructor = builder.constructor;
		this.config = builder.config;
		this.fields = unmodifiableMap(new LinkedHashMap<>(builder.fields));
		this.computed = unmodifiableMap(new LinkedHashMap<>(builder.computed));
		Map<String, List<CheckSpec>> checksByKey = new LinkedHashMap<>();
		builder.checks.forEach(c -> checksByKey.computeIfAbsent(c.key(), k -> new ArrayList<>()).add(c));
		checksByKey.replaceAll((k, v) -> List.copyOf(v));
		this.checks = unmodifiableMap(checksByKey);
		this.graph = new DependencyGraph(computed.values());
		this.matcher = new TypeMatcher(config.matcherSettings());
		this.coercer = new Coercer(matcher, SchemaRegistry.INSTANCE);
	}

	public static <T extends TypedMap> Builder<T> builder(Class<T> type, Function<? super Map<String, Object>, ? extends T> constructor) {
		return new Builder<>(type, constructor);
	}

	/**
	 * The schema of plain {@link TypedMap}s: no declarations and {@link TypedMapConfig#defaults() default} configuration.
	 * Nested mappings are converted into instances of this schema.
	 */
	public static Schema<TypedMap> generic() {
		return GenericHolder.GENERIC;
	}

	public Class<T> type() {
		return type;
	}

	public TypedMapConfig config() {
		return config;
	}

	public Map<String, FieldSpec> fields() {
		return fields;
	}

	public Map<String, ComputedSpec> computed() {
		return computed;
	}

	public boolean isComputed(String name) {
		return computed.containsKey(name);
	}

	/**
	 * @return the checks on {@code key}, in the order they run
	 */
	public List<CheckSpec> checksFor(String key) {
		return checks.getOrDefault(key, List.of());
	}

	public DependencyGraph graph() {
		return graph;
	}

	public TypeMatcher matcher() {
		return matcher;
	}

	/**
	 * Coerces field values when {@link TypedMapConfig#coerce()} is on.
	 * Builds nested declared types using their registered schemas.
	 */
	public Coercer coercer() {
		return coercer;
	}

	/**
	 * Creates an instance through the declaring class's constructor, running the full write path.
	 */
	public T newInstance(Map<String, ?> fields) {
		return constructor.apply(new LinkedHashMap<>(fields));
	}

	@Override
	public String toString() {
		return "Schema(" + type.getSimpleName() + ")";
	}

	public static final class Builder<T extends TypedMap> {
		private final Class<T> type;
		private final Function<? super Map<String, Object>, ? extends T> constructor;
		private TypedMapConfig config = TypedMapConfig.defaults();
		private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
		private final Map<String, ComputedSpec> computed = new LinkedHashMap<>();
		private final List<CheckSpec> checks = new ArrayList<>();

		/**
		 * Names declared directly on this builder, as opposed to inherited.
		 */
		private final Set<String> ownNames = new LinkedHashSet<>();
		private final List<String> duplicates = new ArrayList<>();

		private Builder(Class<T> type, Function<? super Map<String, Object>, ? extends T> constructor) {
			this.type = requireNonNull(type);
			this.constructor = requireNonNull(constructor);
		}

		public Builder<T> config(TypedMapConfig config) {
			this.config = requireNonNull(config);
			return this;
		}

		/**
		 * Inherits the fields, computed members, checks, and configuration of {@code parent}.
		 * Declarations made afterward override inherited ones with the same name.
		 */
		public Builder<T> extending(Schema<? super T> parent) {
			this.config = parent.config();
			parent.fields().forEach(fields::put);
			parent.computed().forEach(computed::put);
			parent.checks.values().forEach(checks::addAll);
			return this;
		}

		/**
		 * Declares a required field.
		 */
		public Builder<T> field(String name, ValueType type) {
			return field(FieldSpec.required(name, type));
		}

		public Builder<T> field(String name, ValueType type, @Nullable Object defaultValue) {
			return field(FieldSpec.withDefault(name, type, defaultValue));
		}

		public Builder<T> fieldWithFactory(String name, ValueType type, Supplier<?> factory) {
			return field(FieldSpec.withFactory(name, type, factory));
		}

		public Builder<T> field(FieldSpec spec) {
			declare(spec.name());
			fields.put(spec.name(), spec);
			return this;
		}

		/**
		 * @param producer computes the member's value from the instance
		 * @param cache if false, every read calls {@code producer}
		 * @param dependencies the keys {@code producer} reads
		 */
		public Builder<T> computed(String name, Function<? super T, ?> producer, boolean cache, String... dependencies) {
			requireNonNull(producer);
			declare(name);
			computed.put(name, new ComputedSpec(name, instance -> producer.apply(type.cast(instance)), cache, List.of(dependencies)));
			return this;
		}

		/**
		 * Adds a check on writes to {@code key}.
		 * Checks on the same key run in the order they were added, each receiving the previous one's result.
		 */
		public Builder<T> check(String key, BiFunction<? super T, Object, ?> check) {
			requireNonNull(check);
			checks.add(new CheckSpec(key, (instance, value) -> check.apply(type.cast(instance), value)));
			return this;
		}

		/**
		 * Registers the methods of the declaring class and its superclasses annotated with
		 * {@link works.typedmap.annotations.Computed Computed} or {@link works.typedmap.annotations.Check Check}.
		 *
		 * @param lookup must have access to the annotated methods
		 */
		public Builder<T> scan(MethodHandles.Lookup lookup) {
			DeclarationScanner.scan(type, lookup, this);
			return this;
		}

		/**
		 * @throws InvalidDeclarationException if the declarations are inconsistent
		 * @throws DependencyCycleException if the computed members depend on each other in a cycle
		 */
		public Schema<T> build() {
			if (!duplicates.isEmpty()) {
				throw new InvalidDeclarationException(type.getSimpleName() + " declares duplicate names " + duplicates);
			}
			for (String name : computed.keySet()) {
				if (fields.containsKey(name)) {
					throw new InvalidDeclarationException("Computed member " + type.getSimpleName() + "." + name + " shadows a field");
				}
			}
			boolean closed = config.strict() && !config.allowExtra();
			for (CheckSpec check : checks) {
				if (computed.containsKey(check.key())) {
					throw new InvalidDeclarationException("Computed member " + type.getSimpleName() + "." + check.key() + " cannot have a check");
				} else if (closed && !fields.containsKey(check.key())) {
					throw new InvalidDeclarationException("Check on undeclared key " + type.getSimpleName() + "." + check.key());
				}
			}
			if (closed) {
				for (ComputedSpec c : computed.values()) {
					for (String dep : c.dependencies()) {
						if (!fields.containsKey(dep) && !computed.containsKey(dep)) {
							throw new InvalidDeclarationException("Computed member " + type.getSimpleName() + "." + c.name() + " depends on undeclared key \"" + dep + "\"");
						}
					}
				}
			}
			Schema<T> result = new Schema<>(this);
			SchemaRegistry.INSTANCE.register(result);
			int numFields = fields.size();
			int numComputed = computed.size();
			LOGGER.info("Built schema for {} with {} field{}, {} computed member{}, {} check{}",
				type.getSimpleName(),
				numFields, (numFields == 1) ? "" : "s",
				numComputed, (numComputed == 1) ? "" : "s",
				checks.size(), (checks.size() == 1) ? "" : "s");
			return result;
		}

		private void declare(String name) {
			requireNonNull(name);
			if (!ownNames.add(name)) {
				duplicates.add(name);
			}
		}
	}

	private static final class GenericHolder {
		static final Schema<TypedMap> GENERIC = Schema.builder(TypedMap.class, TypedMap::new).build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Schema.class);
}
