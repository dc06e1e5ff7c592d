package works.typedmap;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typedmap.annotations.Check;
import works.typedmap.annotations.Computed;
import works.typedmap.exceptions.InvalidDeclarationException;

import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;

/**
 * Finds methods annotated with {@link Computed} and {@link Check} in a {@link TypedMap} subclass
 * and its superclasses, and registers them in a {@link Schema.Builder}.
 * <p>
 * Superclass methods are registered first.
 * Within one class, methods are registered in order of name.
 * An annotated method that overrides another annotated method replaces it.
 */
final class DeclarationScanner {
	static <T extends TypedMap> void scan(Class<T> type, MethodHandles.Lookup lookup, Schema.Builder<T> builder) {
		List<List<Method>> methodsByClass = new ArrayList<>();
		Set<String> seenSignatures = new HashSet<>();
		for (
			Class<?> declaringClass = type;
			declaringClass != null && declaringClass != TypedMap.class;
			declaringClass = declaringClass.getSuperclass()
		) {
			List<Method> annotated = new ArrayList<>();
			Method[] declared = declaringClass.getDeclaredMethods();
			Arrays.sort(declared, METHOD_ORDER);
			for (Method method : declared) {
				if (method.isBridge()) {
					continue;
				}
				if (method.isAnnotationPresent(Computed.class) || method.isAnnotationPresent(Check.class)) {
					if (seenSignatures.add(signature(method))) {
						annotated.add(method);
					}
				}
			}
			methodsByClass.add(0, annotated);
		}

		int declarationCounter = 0;
		for (List<Method> methods : methodsByClass) {
			for (Method method : methods) {
				if (isStatic(method.getModifiers())) {
					throw new InvalidDeclarationException("Declaration method cannot be static: " + method);
				} else if (isPrivate(method.getModifiers())) {
					throw new InvalidDeclarationException("Declaration method cannot be private: " + method);
				}
				try {
					registerOneMethod(method, lookup, builder);
					declarationCounter++;
				} catch (InvalidDeclarationException e) {
					throw new InvalidDeclarationException("Unable to register declaration method "
						+ method.getDeclaringClass().getSimpleName() + "." + method.getName() + ": " + e.getMessage(), e);
				}
			}
		}
		if (declarationCounter == 0) {
			LOGGER.warn("Found no declaration methods in {}; may be misconfigured", type.getSimpleName());
		} else {
			LOGGER.info("Registered {} declaration{} from {}", declarationCounter, (declarationCounter >= 2) ? "s" : "", type.getSimpleName());
		}
	}

	private static <T extends TypedMap> void registerOneMethod(Method method, MethodHandles.Lookup lookup, Schema.Builder<T> builder) {
		MethodHandle handle;
		try {
			handle = lookup.unreflect(method);
		} catch (IllegalAccessException e) {
			throw new InvalidDeclarationException("Method is not accessible to the given lookup", e);
		}

		Computed computed = method.getAnnotation(Computed.class);
		Check check = method.getAnnotation(Check.class);
		if (computed != null && check != null) {
			throw new InvalidDeclarationException("Method cannot be both @Computed and @Check");
		} else if (computed != null) {
			if (method.getParameterCount() != 0) {
				throw new InvalidDeclarationException("@Computed method must have no parameters");
			}
			if (method.getReturnType() == void.class) {
				throw new InvalidDeclarationException("@Computed method must return a value");
			}
			String name = computed.value().isEmpty() ? method.getName() : computed.value();
			builder.computed(name, instance -> invoke(handle, method, instance), computed.cache(), computed.deps());
		} else {
			if (method.getParameterCount() != 1) {
				throw new InvalidDeclarationException("@Check method must have exactly one parameter");
			}
			boolean returnsValue = method.getReturnType() != void.class;
			builder.check(check.value(), (instance, value) -> {
				Object result = invoke(handle, method, instance, value);
				return returnsValue ? result : value;
			});
		}
	}

	private static Object invoke(MethodHandle handle, Method method, Object... arguments) {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to call declaration method \"" + method.getName() + "\"", e);
		}
	}

	private static String signature(Method method) {
		return method.getName() + Arrays.toString(method.getParameterTypes());
	}

	private static final Comparator<Method> METHOD_ORDER = Comparator
		.comparing(Method::getName)
		.thenComparing(m -> Arrays.toString(m.getParameterTypes()));

	private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationScanner.class);
}
