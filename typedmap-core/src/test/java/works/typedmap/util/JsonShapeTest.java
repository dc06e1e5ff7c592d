package works.typedmap.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.typedmap.TypedMap;
import works.typedmap.exceptions.JsonShapeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonShapeTest {

	static Stream<Object> compatible() {
		Map<String, Object> withNull = new HashMap<>();
		withNull.put("nothing", null);
		return Stream.of(
			"text",
			'c',
			true,
			7,
			7L,
			1.5,
			BigInteger.TEN.pow(30),
			new BigDecimal("0.1"),
			List.of(),
			Map.of(),
			Arrays.asList(1, null, "x"),
			withNull,
			Map.of("nested", List.of(Map.of("deep", List.of(1, 2.0, false)))),
			new TypedMap(Map.of("a", Map.of("b", 1)))
		);
	}

	static Stream<Object> incompatible() {
		return Stream.of(
			Set.of(1),
			new int[] { 1 },
			Double.NaN,
			Float.POSITIVE_INFINITY,
			Map.of(1, "numeric key"),
			List.of(new Object()),
			Map.of("a", List.of(Set.of()))
		);
	}

	@ParameterizedTest
	@MethodSource("compatible")
	void compatibleValues_accepted(Object value) {
		assertTrue(JsonShape.isJsonCompatible(value));
		JsonShape.require(value, "value");
	}

	@ParameterizedTest
	@MethodSource("incompatible")
	void incompatibleValues_rejected(Object value) {
		assertFalse(JsonShape.isJsonCompatible(value));
		assertThrows(JsonShapeException.class, () -> JsonShape.require(value, "value"));
	}

	@Test
	void nullIsCompatible() {
		assertTrue(JsonShape.isJsonCompatible(null));
	}

	@Test
	void exception_pointsAtOffendingValue() {
		Set<String> offender = Set.of("x");
		JsonShapeException e = assertThrows(JsonShapeException.class, () ->
			JsonShape.require(Map.of("a", List.of(1, Map.of("b", offender))), "root"));
		assertEquals("root.a[1].b", e.path());
		assertSame(offender, e.offendingValue());
	}
}
