package works.typedmap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.typedmap.exceptions.JsonShapeException;
import works.typedmap.exceptions.MissingFieldException;
import works.typedmap.exceptions.ReadOnlyMemberException;
import works.typedmap.exceptions.UnknownKeyException;
import works.typedmap.types.exceptions.CoercionException;
import works.typedmap.types.exceptions.TypeCheckException;
import works.typedmap.types.exceptions.TypeMismatchException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typedmap.CacheState.CACHED;
import static works.typedmap.CacheState.INVALID;
import static works.typedmap.CacheState.UNCOMPUTED;
import static works.typedmap.types.ValueType.ANY;
import static works.typedmap.types.ValueType.INTEGER;
import static works.typedmap.types.ValueType.STRING;
import static works.typedmap.types.ValueType.mapping;
import static works.typedmap.types.ValueType.sequence;

class TypedMapTest {

	public static class Sums extends TypedMap {
		static final AtomicInteger SUMMED_CALLS = new AtomicInteger();
		static final AtomicInteger DOUBLED_CALLS = new AtomicInteger();
		static final AtomicInteger LABEL_CALLS = new AtomicInteger();

		static final Schema<Sums> SCHEMA = Schema.builder(Sums.class, Sums::new)
			.field("a", INTEGER)
			.field("b", INTEGER)
			.computed("summed", s -> {
				SUMMED_CALLS.incrementAndGet();
				return (Integer) s.get("a") + (Integer) s.get("b");
			}, true, "a", "b")
			.computed("doubled", s -> {
				DOUBLED_CALLS.incrementAndGet();
				return 2 * (Integer) s.get("summed");
			}, true, "summed")
			.computed("label", s -> {
				LABEL_CALLS.incrementAndGet();
				return "sum=" + s.get("summed");
			}, false, "summed")
			.build();

		public Sums(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class Person extends TypedMap {
		static final Schema<Person> SCHEMA = Schema.builder(Person.class, Person::new)
			.config(TypedMapConfig.builder().strict(true).allowExtra(false).build())
			.field("age", INTEGER)
			.build();

		public Person(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class Coerced extends TypedMap {
		static final Schema<Coerced> SCHEMA = Schema.builder(Coerced.class, Coerced::new)
			.config(TypedMapConfig.builder().strict(true).coerce(true).build())
			.field("age", INTEGER)
			.build();

		public Coerced(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class JsonDoc extends TypedMap {
		static final Schema<JsonDoc> SCHEMA = Schema.builder(JsonDoc.class, JsonDoc::new)
			.config(TypedMapConfig.builder().enforceJson(true).build())
			.field("payload", ANY, null)
			.build();

		public JsonDoc(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class Contact extends TypedMap {
		static final Schema<Contact> SCHEMA = Schema.builder(Contact.class, Contact::new)
			.field("email", STRING)
			.fieldWithFactory("tags", sequence(STRING), ArrayList::new)
			.check("email", (contact, email) -> ((String) email).trim().toLowerCase(Locale.ROOT))
			.build();

		public Contact(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}

		public Contact(Map<String, ?> initial, Map<String, ?> overrides) {
			super(SCHEMA, initial, overrides);
		}
	}

	public static class Fragile extends TypedMap {
		static final Schema<Fragile> SCHEMA = Schema.builder(Fragile.class, Fragile::new)
			.field("a", INTEGER)
			.field("b", INTEGER)
			.computed("ratio", f -> (Integer) f.get("a") / (Integer) f.get("b"), true, "a", "b")
			.build();

		public Fragile(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class Server extends TypedMap {
		static final Schema<Server> SCHEMA = Schema.builder(Server.class, Server::new)
			.field("db", ANY)
			.computed("host", s -> ((Map<?, ?>) s.get("db")).get("host"), true, "db")
			.build();

		public Server(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	public static class Ports extends TypedMap {
		static final Schema<Ports> SCHEMA = Schema.builder(Ports.class, Ports::new)
			.config(TypedMapConfig.builder().strict(true).build())
			.field("db", mapping(STRING, INTEGER))
			.field("scores", sequence(INTEGER))
			.build();

		public Ports(Map<String, ?> fields) {
			super(SCHEMA, fields);
		}
	}

	@BeforeEach
	void resetCounters() {
		Sums.SUMMED_CALLS.set(0);
		Sums.DOUBLED_CALLS.set(0);
		Sums.LABEL_CALLS.set(0);
	}

	@Test
	void computedCache_producesOncePerChange() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));

		assertEquals(6, sums.get("doubled"));
		assertEquals(6, sums.get("doubled"));
		assertEquals(1, Sums.SUMMED_CALLS.get());
		assertEquals(1, Sums.DOUBLED_CALLS.get());

		sums.put("b", 10);
		assertEquals(22, sums.get("doubled"));
		assertEquals(2, Sums.SUMMED_CALLS.get());
		assertEquals(2, Sums.DOUBLED_CALLS.get());
	}

	@Test
	void cacheState_followsLifecycle() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		assertEquals(UNCOMPUTED, sums.cacheState("summed"));

		sums.get("summed");
		assertEquals(CACHED, sums.cacheState("summed"));
		assertEquals(UNCOMPUTED, sums.cacheState("doubled"));

		sums.put("a", 5);
		assertEquals(INVALID, sums.cacheState("summed"));

		assertEquals(7, sums.get("summed"));
		assertEquals(CACHED, sums.cacheState("summed"));
	}

	@Test
	void writeToUnrelatedKey_invalidatesNothing() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("doubled");
		sums.put("unrelated", "x");
		assertEquals(CACHED, sums.cacheState("summed"));
		assertEquals(CACHED, sums.cacheState("doubled"));
	}

	@Test
	void nonCachingMember_alwaysRecomputed() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		assertEquals("sum=3", sums.get("label"));
		assertEquals("sum=3", sums.get("label"));
		assertEquals(2, Sums.LABEL_CALLS.get());
		assertEquals(1, Sums.SUMMED_CALLS.get(), "The cached member it reads is still cached");
		assertEquals(UNCOMPUTED, sums.cacheState("label"));
	}

	@Test
	void manualInvalidation_reachesDependents() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("doubled");

		sums.invalidate("summed");
		assertEquals(INVALID, sums.cacheState("summed"));
		assertEquals(INVALID, sums.cacheState("doubled"));

		sums.get("doubled");
		sums.invalidateAll();
		assertEquals(INVALID, sums.cacheState("summed"));
		assertEquals(INVALID, sums.cacheState("doubled"));

		assertThrows(IllegalArgumentException.class, () -> sums.invalidate("a"));
		assertThrows(IllegalArgumentException.class, () -> sums.cacheState("nope"));
	}

	@Test
	void failedProduction_leavesCacheStateAlone() {
		Fragile fragile = new Fragile(Map.of("a", 6, "b", 3));
		assertEquals(2, fragile.get("ratio"));
		fragile.put("b", 0);
		assertEquals(INVALID, fragile.cacheState("ratio"));

		assertThrows(ArithmeticException.class, () -> fragile.get("ratio"));
		assertEquals(INVALID, fragile.cacheState("ratio"));

		fragile.put("b", 2);
		assertEquals(3, fragile.get("ratio"));
	}

	@Test
	void computedMembers_areReadOnlyVirtualKeys() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));

		assertTrue(sums.containsKey("summed"));
		assertEquals(3, sums.get("summed"));
		assertEquals(2, sums.size());
		assertEquals(Set.of("a", "b"), sums.keySet());

		ReadOnlyMemberException e = assertThrows(ReadOnlyMemberException.class, () -> sums.put("summed", 5));
		assertEquals("summed", e.memberName());
		assertThrows(ReadOnlyMemberException.class, () -> sums.remove("summed"));
		assertThrows(ReadOnlyMemberException.class, () -> new Sums(Map.of("a", 1, "b", 2, "summed", 0)));
	}

	@Test
	void strictWithoutExtras_rejectsUnknownKeysAndWrongTypes() {
		Person person = new Person(Map.of("age", 30));

		UnknownKeyException unknown = assertThrows(UnknownKeyException.class, () -> person.put("nickname", "Al"));
		assertEquals("nickname", unknown.key());

		TypeMismatchException mismatch = assertThrows(TypeMismatchException.class, () -> person.put("age", "thirty"));
		assertEquals(TypeMismatchException.Site.FIELD, mismatch.site());
		assertEquals("age", mismatch.name());
		assertEquals(INTEGER, mismatch.expected());

		assertThrows(TypeMismatchException.class, () -> person.put("age", true), "Booleans are not integers");
	}

	@Test
	void failedWrite_leavesMapUnchanged() {
		Person person = new Person(Map.of("age", 30));
		assertThrows(TypeMismatchException.class, () -> person.put("age", "thirty"));
		assertEquals(Map.of("age", 30), person);
	}

	@Test
	void nonStrict_acceptsAnything() {
		TypedMap map = new TypedMap();
		map.put("x", 1);
		map.put("x", "one");
		assertEquals("one", map.get("x"));
	}

	@Test
	void coercion_convertsFieldValues() {
		Coerced coerced = new Coerced(Map.of("age", "5"));
		assertEquals(5, coerced.get("age"));
		assertInstanceOf(Integer.class, coerced.get("age"));

		TypeCheckException e = assertThrows(TypeCheckException.class, () -> coerced.put("age", "not-a-number"));
		assertInstanceOf(CoercionException.class, e);
		assertEquals(5, coerced.get("age"));
	}

	@Test
	void enforceJson_rejectsSetsAndAcceptsJsonObjects() {
		assertThrows(JsonShapeException.class, () -> new JsonDoc(Map.of("payload", Set.of(1, 2))));

		JsonDoc doc = new JsonDoc(Map.of());
		JsonShapeException e = assertThrows(JsonShapeException.class, () -> doc.put("payload", List.of(Set.of("x"))));
		assertEquals("payload[0]", e.path());

		doc.put("payload", Map.of("name", "x", "count", 3, "ok", true));
		assertEquals(Map.of("name", "x", "count", 3, "ok", true), doc.get("payload"));
	}

	@Test
	void check_transformsEveryWrite() {
		Contact contact = new Contact(Map.of("email", "  TEST@EMAIL.COM  "));
		assertEquals("test@email.com", contact.get("email"));

		contact.put("email", "NEW@MAIL.COM");
		assertEquals("new@mail.com", contact.get("email"));

		contact.entrySet().iterator().next().setValue(" Entry@Mail.com");
		assertEquals("entry@mail.com", contact.get("email"));
	}

	@Test
	void overrides_takePrecedence() {
		Contact contact = new Contact(Map.of("email", "a@b.c"), Map.of("email", "OVERRIDE@b.c"));
		assertEquals("override@b.c", contact.get("email"));
	}

	@Test
	void missingRequiredFields_rejected() {
		MissingFieldException e = assertThrows(MissingFieldException.class, () -> new Sums(Map.of("a", 1)));
		assertEquals(List.of("b"), e.fieldNames());
		assertEquals(Sums.class, e.containingClass());
	}

	@Test
	void factory_calledPerInstance() {
		Contact first = new Contact(Map.of("email", "a@b.c"));
		Contact second = new Contact(Map.of("email", "a@b.c"));
		assertEquals(List.of(), first.get("tags"));
		assertNotSame(first.get("tags"), second.get("tags"));
	}

	@Test
	void nestedMapping_convertedLazilyAndPersisted() {
		TypedMap map = new TypedMap(Map.of("inner", Map.of("x", 1)));
		Object first = map.get("inner");
		assertInstanceOf(TypedMap.class, first);
		assertSame(first, map.get("inner"));
		assertEquals(Map.of("x", 1), first);
	}

	@Test
	void listOfMappings_convertedLazilyAndPersisted() {
		TypedMap map = new TypedMap(Map.of("rows", List.of(Map.of("a", 1), "plain")));
		List<?> rows = map.get("rows", List.class);
		assertInstanceOf(TypedMap.class, rows.get(0));
		assertEquals("plain", rows.get(1));
		assertSame(rows, map.get("rows"));
	}

	@Test
	void listWithoutMappings_returnedAsIs() {
		List<Integer> numbers = List.of(1, 2);
		TypedMap map = new TypedMap(Map.of("numbers", numbers));
		assertSame(numbers, map.get("numbers"));
	}

	@Test
	void lazyConversion_doesNotInvalidate() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2, "extra", Map.of("k", "v")));
		sums.get("summed");
		sums.get("extra");
		assertEquals(CACHED, sums.cacheState("summed"));
	}

	@Test
	void autoConvertOff_leavesNestedMappingsPlain() {
		class Plain extends TypedMap {
			Plain(Schema<?> schema, Map<String, ?> fields) {
				super(schema, fields);
			}
		}
		Schema<Plain> schema = Schema.builder(Plain.class, m -> { throw new UnsupportedOperationException(); })
			.config(TypedMapConfig.builder().autoConvert(false).build())
			.build();
		Map<String, Integer> inner = Map.of("x", 1);
		Plain plain = new Plain(schema, Map.of("inner", inner));
		assertSame(inner, plain.get("inner"));
	}

	@Test
	void getAndRequire_differOnAbsentKeys() {
		TypedMap map = new TypedMap(Map.of("a", 1));
		assertNull(map.get("b"));
		assertNull(map.get(42));
		UnknownKeyException e = assertThrows(UnknownKeyException.class, () -> map.require("b"));
		assertEquals("b", e.key());
		assertEquals(1, map.require("a"));
	}

	@Test
	void typedGet_casts() {
		TypedMap map = new TypedMap(Map.of("a", 1));
		Integer a = map.get("a", Integer.class);
		assertEquals(1, a);
		assertThrows(ClassCastException.class, () -> map.get("a", String.class));
	}

	@Test
	void removal_invalidatesDependents() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("doubled");
		sums.remove("b");
		assertEquals(INVALID, sums.cacheState("summed"));
		assertEquals(INVALID, sums.cacheState("doubled"));
	}

	@Test
	void iteratorRemoval_invalidatesDependents() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("summed");
		Iterator<String> keys = sums.keySet().iterator();
		while (keys.hasNext()) {
			if (keys.next().equals("a")) {
				keys.remove();
			}
		}
		assertFalse(sums.containsKey("a"));
		assertEquals(INVALID, sums.cacheState("summed"));
	}

	@Test
	void clear_invalidatesEverything() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("doubled");
		sums.clear();
		assertTrue(sums.isEmpty());
		assertEquals(INVALID, sums.cacheState("doubled"));
	}

	@Test
	void merge_isDeep() {
		TypedMap config = new TypedMap(Map.of("db", Map.of("host", "localhost", "port", 5432)));
		config.merge(Map.of("db", Map.of("port", 3306, "ssl", true)));
		assertTrue(config.deepEquals(Map.of("db", Map.of("host", "localhost", "port", 3306, "ssl", true))));
	}

	@Test
	void merge_replacesNonMappings() {
		TypedMap map = new TypedMap(Map.of("a", Map.of("x", 1), "b", 2));
		map.merge(Map.of("a", 5, "b", Map.of("y", 2)));
		assertTrue(map.deepEquals(Map.of("a", 5, "b", Map.of("y", 2))));
	}

	@Test
	void merge_runsWritePath() {
		Person person = new Person(Map.of("age", 1));
		assertThrows(UnknownKeyException.class, () -> person.merge(Map.of("other", 1)));
		assertThrows(ReadOnlyMemberException.class, () -> new Sums(Map.of("a", 1, "b", 1)).merge(Map.of("summed", 1)));
	}

	@Test
	void merge_invalidatesParentKey() {
		Server server = new Server(Map.of("db", Map.of("host", "a", "port", 1)));
		assertEquals("a", server.get("host"));
		server.get("db");
		server.merge(Map.of("db", Map.of("host", "b")));
		assertEquals(INVALID, server.cacheState("host"));
		assertEquals("b", server.get("host"));
		assertEquals(1, server.getNested("db.port"));
	}

	@Test
	void merge_enforcesDeclaredTypeOfNestedMapping() {
		Ports ports = new Ports(Map.of("db", Map.of("port", 1), "scores", List.of(1)));
		assertThrows(TypeMismatchException.class, () -> ports.merge(Map.of("db", Map.of("port", "oops"))));
		assertEquals(Map.of("port", 1), ports.get("db"));

		// Now "db" has been converted to a TypedMap by the read
		assertThrows(TypeMismatchException.class, () -> ports.merge(Map.of("db", Map.of("port", "oops"))));
		assertEquals(Map.of("port", 1), ports.get("db"));

		ports.merge(Map.of("db", Map.of("replica", 2)));
		assertEquals(Map.of("port", 1, "replica", 2), ports.get("db"));
	}

	@Test
	void merge_isAllOrNothing() {
		Ports ports = new Ports(Map.of("db", Map.of("port", 1), "scores", List.of(1)));
		Map<String, Object> update = new LinkedHashMap<>();
		update.put("scores", List.of(2, 3));
		update.put("db", Map.of("port", "oops"));
		assertThrows(TypeMismatchException.class, () -> ports.merge(update));
		assertEquals(List.of(1), ports.get("scores"));
	}

	@Test
	void merge_enforcesJsonOnNestedValues() {
		JsonDoc doc = new JsonDoc(Map.of("payload", Map.of("a", 1)));
		JsonShapeException e = assertThrows(JsonShapeException.class, () ->
			doc.merge(Map.of("payload", Map.of("s", Set.of(1)))));
		assertEquals("payload.s", e.path());
		assertEquals(Map.of("a", 1), doc.get("payload"));
	}

	@Test
	void merge_leavesNestedInstancesAlone() {
		TypedMap inner = new TypedMap(Map.of("a", 1));
		TypedMap outer = new TypedMap(Map.of("inner", inner));
		outer.merge(Map.of("inner", Map.of("b", 2)));
		assertEquals(Map.of("a", 1), inner);
		assertEquals(Map.of("a", 1, "b", 2), outer.get("inner"));
	}

	@Test
	void enforceJson_acceptsCharactersInStringFields() {
		class Letters extends TypedMap {
			Letters(Schema<?> schema, Map<String, ?> fields) {
				super(schema, fields);
			}
		}
		Schema<Letters> schema = Schema.builder(Letters.class, m -> { throw new UnsupportedOperationException(); })
			.config(TypedMapConfig.builder().strict(true).enforceJson(true).build())
			.field("initial", STRING)
			.build();
		Letters letters = new Letters(schema, Map.of("initial", 'A'));
		assertEquals('A', letters.get("initial"));
	}

	@Test
	void validate_rerunsWritePath() {
		Contact contact = new Contact(Map.of("email", "a@b.c"));
		contact.validate();
		assertEquals("a@b.c", contact.get("email"));

		contact.remove("email");
		assertThrows(MissingFieldException.class, contact::validate);
	}

	@Test
	void copy_isIndependentInstanceOfSameClass() {
		Contact original = new Contact(Map.of("email", "a@b.c"));
		Contact copy = original.copy();
		assertEquals(original, copy);
		assertNotSame(original, copy);
		copy.put("email", "x@y.z");
		assertEquals("a@b.c", original.get("email"));
	}

	@Test
	void equality_isMapEquality() {
		TypedMap map = new TypedMap(Map.of("a", Map.of("b", 1)));
		assertEquals(Map.of("a", Map.of("b", 1)), map);
		assertEquals(map, Map.of("a", Map.of("b", 1)));
		assertEquals(Map.of("a", Map.of("b", 1)).hashCode(), map.hashCode());
	}

	@Test
	void toString_namesClass() {
		assertEquals("Person{age=30}", new Person(Map.of("age", 30)).toString());
	}

	@Test
	void wrongSchema_rejected() {
		class Impostor extends TypedMap {
			Impostor() {
				super(Person.SCHEMA, Map.of("age", 1));
			}
		}
		assertThrows(IllegalArgumentException.class, Impostor::new);
	}

	@Test
	void toPlainMap_omitsComputedMembers() {
		Sums sums = new Sums(Map.of("a", 1, "b", 2));
		sums.get("summed");
		assertEquals(Map.of("a", 1, "b", 2), sums.toPlainMap());
	}
}
