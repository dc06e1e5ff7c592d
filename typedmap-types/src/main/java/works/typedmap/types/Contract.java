package works.typedmap.types;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.NotNull;
import works.typedmap.types.exceptions.TypeMismatchException;

import static java.util.Objects.requireNonNull;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.ARGUMENT;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.RETURN;

/**
 * The declared parameter types and return type of a callable.
 * Checks are strict: a {@link Contract} never coerces.
 *
 * @param parameters in declaration order, with unique names
 */
public record Contract(List<Param> parameters, ValueType returnType) {
	public Contract {
		parameters = List.copyOf(parameters);
		requireNonNull(returnType);
		Set<String> names = new HashSet<>();
		for (Param p : parameters) {
			if (!names.add(p.name())) {
				throw new IllegalArgumentException("Duplicate parameter name \"" + p.name() + "\"");
			}
		}
	}

	public record Param(String name, ValueType type) {
		public Param {
			requireNonNull(name);
			requireNonNull(type);
		}

		@Override
		public String toString() {
			return name + ": " + type;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Derives a contract from a method's generic signature.
	 * Parameter names are only meaningful if the method's class was compiled with {@code -parameters}.
	 */
	public static Contract of(Method method) {
		List<Param> params = new ArrayList<>();
		Parameter[] reflected = method.getParameters();
		for (Parameter p : reflected) {
			params.add(new Param(p.getName(), ValueType.of(p.getParameterizedType())));
		}
		return new Contract(params, ValueType.of(method.getGenericReturnType()));
	}

	/**
	 * @return a function that checks each call against this contract, using the
	 * {@link TypeMatcher#standard() standard} matcher, and runs {@code body} if the arguments conform.
	 */
	public <R> CheckedFunction<R> bind(Function<Arguments, R> body) {
		return bind(body, TypeMatcher.standard());
	}

	public <R> CheckedFunction<R> bind(Function<Arguments, R> body, TypeMatcher matcher) {
		return new Bound<>(this, requireNonNull(body), matcher);
	}

	/**
	 * @throws TypeMismatchException if an argument doesn't conform
	 */
	public void checkArguments(Object[] arguments, TypeMatcher matcher) {
		if (arguments.length != parameters.size()) {
			throw new IllegalArgumentException("Expected " + parameters.size() + " argument" + (parameters.size() == 1 ? "" : "s")
				+ " but got " + arguments.length);
		}
		for (int i = 0; i < arguments.length; i++) {
			Param param = parameters.get(i);
			Object argument = arguments[i];
			Optional<Mismatch> mismatch = matcher.check(argument, param.type());
			if (mismatch.isPresent()) {
				throw new TypeMismatchException(ARGUMENT, param.name(), param.type(), argument, mismatch.get());
			}
		}
	}

	/**
	 * @return {@code result}
	 * @throws TypeMismatchException if {@code result} doesn't conform to {@link #returnType}
	 */
	public <R> R checkResult(R result, TypeMatcher matcher) {
		Optional<Mismatch> mismatch = matcher.check(result, returnType);
		if (mismatch.isPresent()) {
			throw new TypeMismatchException(RETURN, null, returnType, result, mismatch.get());
		}
		return result;
	}

	int indexOf(String name) {
		for (int i = 0; i < parameters.size(); i++) {
			if (parameters.get(i).name().equals(name)) {
				return i;
			}
		}
		throw new IllegalArgumentException("No parameter named \"" + name + "\"");
	}

	@Override
	public String toString() {
		return parameters + " -> " + returnType;
	}

	public static final class Builder {
		private final List<Param> parameters = new ArrayList<>();
		private ValueType returnType = ValueType.ANY;

		private Builder() { }

		public Builder param(String name, ValueType type) {
			parameters.add(new Param(name, type));
			return this;
		}

		public Builder returns(ValueType type) {
			this.returnType = requireNonNull(type);
			return this;
		}

		public Contract build() {
			return new Contract(parameters, returnType);
		}

		public <R> CheckedFunction<R> bind(Function<Arguments, R> body) {
			return build().bind(body);
		}
	}

	private record Bound<R>(
		Contract contract,
		Function<Arguments, R> body,
		TypeMatcher matcher
	) implements CheckedFunction<R> {
		@Override
		public R call(Object... arguments) {
			Object[] args = (arguments == null) ? new Object[] { null } : arguments;
			contract.checkArguments(args, matcher);
			R result = body.apply(new Arguments(contract, Arrays.asList(args.clone())));
			return contract.checkResult(result, matcher);
		}

		@Override
		public R callNamed(@NotNull Map<String, ?> arguments) {
			Set<String> unknown = new LinkedHashSet<>(arguments.keySet());
			Object[] positional = new Object[contract.parameters().size()];
			for (int i = 0; i < positional.length; i++) {
				String name = contract.parameters().get(i).name();
				if (!arguments.containsKey(name)) {
					throw new IllegalArgumentException("Missing argument \"" + name + "\"");
				}
				positional[i] = arguments.get(name);
				unknown.remove(name);
			}
			if (!unknown.isEmpty()) {
				throw new IllegalArgumentException("Unknown argument" + (unknown.size() == 1 ? " " : "s ") + unknown);
			}
			return call(positional);
		}

		@Override
		public String toString() {
			return "CheckedFunction" + contract;
		}
	}
}
