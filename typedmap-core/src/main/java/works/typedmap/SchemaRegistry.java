package works.typedmap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typedmap.types.InstanceBuilder;

/**
 * Finds the {@link Schema} of each {@link TypedMap} subclass,
 * so the {@link works.typedmap.types.Coercer Coercer} can build
 * {@link works.typedmap.types.InstanceType instances} of declared types from mappings.
 */
final class SchemaRegistry implements InstanceBuilder {
	static final SchemaRegistry INSTANCE = new SchemaRegistry();

	private final Map<Class<?>, Schema<?>> schemas = new ConcurrentHashMap<>();

	private SchemaRegistry() { }

	void register(Schema<?> schema) {
		Schema<?> previous = schemas.put(schema.type(), schema);
		if (previous != null) {
			LOGGER.debug("Replaced schema for {}", schema.type().getSimpleName());
		}
	}

	Schema<?> schemaFor(Class<?> type) {
		Schema<?> result = schemas.get(type);
		if (result == null) {
			// Schemas are usually static constants, registered when their class initializes
			try {
				Class.forName(type.getName(), true, type.getClassLoader());
			} catch (ClassNotFoundException e) {
				throw new IllegalArgumentException("Unable to initialize " + type.getSimpleName(), e);
			}
			result = schemas.get(type);
		}
		if (result == null) {
			throw new IllegalArgumentException("No schema registered for " + type.getSimpleName());
		}
		return result;
	}

	@Override
	public Object build(Class<?> instanceClass, Map<?, ?> fields) {
		if (!TypedMap.class.isAssignableFrom(instanceClass)) {
			throw new IllegalArgumentException(instanceClass.getSimpleName() + " is not a TypedMap");
		}
		Map<String, Object> stringKeyed = new LinkedHashMap<>();
		fields.forEach((k, v) -> {
			if (k instanceof String s) {
				stringKeyed.put(s, v);
			} else {
				throw new IllegalArgumentException("Key " + k + " is not a string");
			}
		});
		return schemaFor(instanceClass).newInstance(stringKeyed);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);
}
