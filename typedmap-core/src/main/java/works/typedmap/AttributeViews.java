package works.typedmap;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import works.typedmap.annotations.Attribute;

import static java.util.Collections.unmodifiableMap;

/**
 * Implements {@link TypedMap#as}: interface proxies whose getters and setters
 * read and write keys through the {@link TypedMap}'s usual read and write paths.
 * <p>
 * A method with no parameters is a getter for the key named by the method
 * (less any {@code get} or {@code is} prefix), and a method with one parameter
 * is a setter (less any {@code set} prefix). {@link Attribute} overrides the key.
 * Setters return {@code void} or the view itself, for chaining.
 */
final class AttributeViews {
	private AttributeViews() { }

	static <V> V view(TypedMap map, Class<V> viewInterface) {
		if (!viewInterface.isInterface()) {
			throw new IllegalArgumentException(viewInterface.getSimpleName() + " is not an interface");
		}
		Map<Method, Accessor> accessors = ACCESSORS.get(viewInterface);
		return viewInterface.cast(Proxy.newProxyInstance(
			viewInterface.getClassLoader(),
			new Class<?>[] { viewInterface },
			new Handler(map, viewInterface, accessors)));
	}

	private sealed interface Accessor permits Getter, Setter, DefaultMethod { }

	private record Getter(String key, Class<?> returnType) implements Accessor { }

	private record Setter(String key, boolean fluent) implements Accessor { }

	private record DefaultMethod() implements Accessor { }

	private static Map<Method, Accessor> accessorsFor(Class<?> viewInterface) {
		Map<Method, Accessor> result = new HashMap<>();
		for (Method method : viewInterface.getMethods()) {
			if (Modifier.isStatic(method.getModifiers())) {
				continue;
			}
			result.put(method, accessorFor(viewInterface, method));
		}
		return unmodifiableMap(result);
	}

	private static Accessor accessorFor(Class<?> viewInterface, Method method) {
		if (method.isDefault()) {
			return new DefaultMethod();
		}
		Attribute attribute = method.getAnnotation(Attribute.class);
		String name = method.getName();
		switch (method.getParameterCount()) {
			case 0: {
				if (method.getReturnType() == void.class) {
					break;
				}
				boolean isBoolean = method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class;
				String key = (attribute != null) ? attribute.value()
					: hasPrefix(name, "get") ? decapitalize(name.substring(3))
					: (isBoolean && hasPrefix(name, "is")) ? decapitalize(name.substring(2))
					: name;
				return new Getter(key, method.getReturnType());
			}
			case 1: {
				Class<?> returnType = method.getReturnType();
				boolean fluent = returnType.isAssignableFrom(viewInterface) && returnType != Object.class;
				if (returnType != void.class && !fluent) {
					break;
				}
				String key = (attribute != null) ? attribute.value()
					: hasPrefix(name, "set") ? decapitalize(name.substring(3))
					: name;
				return new Setter(key, fluent);
			}
			default:
				break;
		}
		throw new IllegalArgumentException("Method " + viewInterface.getSimpleName() + "." + name + " is neither a getter nor a setter");
	}

	private static boolean hasPrefix(String name, String prefix) {
		return name.length() > prefix.length()
			&& name.startsWith(prefix)
			&& Character.isUpperCase(name.charAt(prefix.length()));
	}

	private static String decapitalize(String s) {
		return Character.toLowerCase(s.charAt(0)) + s.substring(1);
	}

	@RequiredArgsConstructor
	private static final class Handler implements InvocationHandler {
		private final TypedMap map;
		private final Class<?> viewInterface;
		private final Map<Method, Accessor> accessors;

		@Override
		public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
			if (method.getDeclaringClass() == Object.class) {
				switch (method.getName()) {
					case "equals":
						return proxy == args[0];
					case "hashCode":
						return System.identityHashCode(proxy);
					case "toString":
						return viewInterface.getSimpleName() + map;
					default:
						throw new AssertionError("Unexpected Object method: " + method);
				}
			}
			Accessor accessor = accessors.get(method);
			if (accessor instanceof Getter getter) {
				return adapt(map.require(getter.key()), getter);
			} else if (accessor instanceof Setter setter) {
				map.put(setter.key(), args[0]);
				return setter.fluent() ? proxy : null;
			} else if (accessor instanceof DefaultMethod) {
				return InvocationHandler.invokeDefault(proxy, method, args);
			}
			throw new AssertionError("No accessor for " + method);
		}

		private Object adapt(@Nullable Object value, Getter getter) {
			Class<?> returnType = getter.returnType();
			if (value == null) {
				if (returnType.isPrimitive()) {
					throw new ClassCastException("Key \"" + getter.key() + "\" is null, which is not a " + returnType);
				}
				return null;
			}
			Class<?> boxed = returnType.isPrimitive() ? box(returnType) : returnType;
			if (boxed.isInstance(value)) {
				return value;
			} else if (returnType.isInterface() && value instanceof TypedMap nested) {
				return nested.as(returnType);
			}
			throw new ClassCastException("Key \"" + getter.key() + "\" holds " + value.getClass().getSimpleName() + ", not " + returnType.getSimpleName());
		}
	}

	private static Class<?> box(Class<?> primitive) {
		return PRIMITIVE_BOXES.get(primitive);
	}

	private static final Map<Class<?>, Class<?>> PRIMITIVE_BOXES = Map.of(
		boolean.class, Boolean.class,
		byte.class, Byte.class,
		short.class, Short.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class,
		char.class, Character.class);

	private static final ClassValue<Map<Method, Accessor>> ACCESSORS = new ClassValue<>() {
		@Override
		protected Map<Method, Accessor> computeValue(Class<?> type) {
			return accessorsFor(type);
		}
	};
}
