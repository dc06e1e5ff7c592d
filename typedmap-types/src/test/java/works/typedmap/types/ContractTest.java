package works.typedmap.types;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.typedmap.types.exceptions.TypeMismatchException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typedmap.types.ValueType.INTEGER;
import static works.typedmap.types.ValueType.NONE;
import static works.typedmap.types.ValueType.STRING;
import static works.typedmap.types.ValueType.optional;
import static works.typedmap.types.ValueType.sequence;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.ARGUMENT;
import static works.typedmap.types.exceptions.TypeMismatchException.Site.RETURN;

class ContractTest {
	final CheckedFunction<String> repeat = Contract.builder()
		.param("text", STRING)
		.param("times", INTEGER)
		.returns(STRING)
		.bind(args -> ((String) args.get("text")).repeat(args.get("times", Integer.class)));

	@Test
	void conformingCall_runsBody() {
		assertEquals("abab", repeat.call("ab", 2));
		assertEquals("xxx", repeat.callNamed(Map.of("times", 3, "text", "x")));
	}

	@Test
	void badArgument_rejectedBeforeBodyRuns() {
		int[] calls = { 0 };
		CheckedFunction<Object> counted = Contract.builder()
			.param("n", INTEGER)
			.bind(args -> ++calls[0]);

		TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> counted.call("5"));
		assertEquals(ARGUMENT, e.site());
		assertEquals("n", e.name());
		assertEquals(INTEGER, e.expected());
		assertEquals("5", e.actual());
		assertEquals(0, calls[0]);
	}

	@Test
	void badResult_isReturnViolation() {
		CheckedFunction<Object> liar = Contract.builder()
			.returns(sequence(INTEGER))
			.bind(args -> List.of(1, "two"));

		TypeMismatchException e = assertThrows(TypeMismatchException.class, liar::call);
		assertEquals(RETURN, e.site());
		assertTrue(e.isReturnViolation());
		assertEquals("$[1]", e.mismatch().path());
	}

	@Test
	void result_isReturnedAsIs() {
		List<Integer> result = List.of(1, 2);
		CheckedFunction<List<Integer>> f = Contract.builder()
			.returns(sequence(INTEGER))
			.bind(args -> result);
		assertSame(result, f.call());
	}

	@Test
	void nullArgument_acceptedWhereOptional() {
		CheckedFunction<Object> f = Contract.builder()
			.param("maybe", optional(STRING))
			.returns(NONE)
			.bind(args -> null);
		assertNull(f.call((Object) null));
		assertThrows(TypeMismatchException.class, () -> f.call(5));
	}

	@Test
	void wrongArity_rejected() {
		assertThrows(IllegalArgumentException.class, () -> repeat.call("a"));
		assertThrows(IllegalArgumentException.class, () -> repeat.call("a", 1, 2));
	}

	@Test
	void namedCall_requiresExactNames() {
		assertThrows(IllegalArgumentException.class, () -> repeat.callNamed(Map.of("text", "a")));
		Map<String, Object> extra = new LinkedHashMap<>();
		extra.put("text", "a");
		extra.put("times", 1);
		extra.put("sep", ",");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> repeat.callNamed(extra));
		assertTrue(e.getMessage().contains("sep"), e.getMessage());
	}

	@Test
	void exceptionsFromBody_propagate() {
		CheckedFunction<Object> failing = Contract.builder()
			.bind(args -> { throw new IllegalStateException("boom"); });
		IllegalStateException e = assertThrows(IllegalStateException.class, failing::call);
		assertEquals("boom", e.getMessage());
	}

	@Test
	void duplicateParameter_rejected() {
		assertThrows(IllegalArgumentException.class, () -> Contract.builder()
			.param("a", INTEGER)
			.param("a", STRING)
			.build());
	}

	public interface Shapes {
		List<String> labels(int count, String prefix);
	}

	@Test
	void of_derivesFromMethodSignature() throws NoSuchMethodException {
		Contract contract = Contract.of(Shapes.class.getMethod("labels", int.class, String.class));
		assertEquals(List.of(
				new Contract.Param("count", INTEGER),
				new Contract.Param("prefix", STRING)),
			contract.parameters());
		assertEquals(sequence(STRING), contract.returnType());
	}
}
