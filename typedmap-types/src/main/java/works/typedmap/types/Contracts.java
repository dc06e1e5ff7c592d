package works.typedmap.types;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Wraps implementations of an interface so that every call is checked
 * against the {@link Contract} derived from the interface method's generic signature.
 * <pre>
 *     Greeter checked = Contracts.enforce(Greeter.class, new GreeterImpl());
 * </pre>
 * The arguments are checked before the target method runs,
 * and the result is checked before it is returned.
 * Exceptions thrown by the target propagate unchanged.
 * Methods declared by {@link Object} are passed through unchecked.
 */
public final class Contracts {
	private Contracts() { }

	public static <I> I enforce(Class<I> iface, I target) {
		return enforce(iface, target, TypeMatcher.standard());
	}

	@SuppressWarnings("unchecked")
	public static <I> I enforce(Class<I> iface, I target, TypeMatcher matcher) {
		requireNonNull(target);
		if (!iface.isInterface()) {
			throw new IllegalArgumentException("Contracts can only be enforced through an interface; " + iface.getSimpleName() + " is not one");
		}
		LOGGER.debug("Enforcing contracts of {} on {}", iface.getSimpleName(), target.getClass().getSimpleName());
		return (I) Proxy.newProxyInstance(
			iface.getClassLoader(),
			new Class<?>[] { iface },
			new Handler(target, matcher));
	}

	/**
	 * @return the contract that {@link #enforce} applies to {@code method}
	 */
	public static Contract contractOf(Method method) {
		return CONTRACTS.computeIfAbsent(method, Contract::of);
	}

	private record Handler(Object target, TypeMatcher matcher) implements InvocationHandler {
		@Override
		public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
			Object[] arguments = (args == null) ? new Object[0] : args;
			if (method.getDeclaringClass() == Object.class) {
				return invokeTarget(method, arguments);
			}
			Contract contract = contractOf(method);
			contract.checkArguments(arguments, matcher);
			Object result = invokeTarget(method, arguments);
			return contract.checkResult(result, matcher);
		}

		private Object invokeTarget(Method method, Object[] arguments) throws Throwable {
			try {
				return method.invoke(target, arguments);
			} catch (InvocationTargetException e) {
				throw e.getCause();
			}
		}
	}

	private static final Map<Method, Contract> CONTRACTS = new ConcurrentHashMap<>();
	private static final Logger LOGGER = LoggerFactory.getLogger(Contracts.class);
}
