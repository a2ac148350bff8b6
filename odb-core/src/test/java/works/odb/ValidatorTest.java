package works.odb;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.odb.exceptions.MissingFieldException;
import works.odb.exceptions.PredicateFailedException;
import works.odb.state.ObservedObject;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidatorTest {
	Validator validator;

	@BeforeEach
	void setup() {
		validator = new Validator();
		validator.register("users", Schema.builder()
			.field("name", v -> v instanceof String, "name must be a string")
			.field("age", v -> v instanceof Number n && n.intValue() >= 0, "age must be non-negative")
			.build());
	}

	@Test
	void noSchema_acceptsAnything() {
		assertFalse(validator.hasSchema("other"));
		assertDoesNotThrow(() -> validator.validateData("other", ObservedObject.of(Map.of("x", 1))));
		assertDoesNotThrow(() -> validator.validateData("other", null));
	}

	@Test
	void validData_passes() {
		assertTrue(validator.hasSchema("users"));
		assertDoesNotThrow(() -> validator.validateData("users", ObservedObject.of(Map.of("name", "alice", "age", 30))));
	}

	@Test
	void missingField() {
		MissingFieldException e = assertThrows(MissingFieldException.class,
			() -> validator.validateData("users", ObservedObject.of(Map.of("name", "alice"))));
		assertEquals("Validation Error: Missing field 'age' in collection 'users'.", e.getMessage());
		assertEquals("users", e.collection());
		assertEquals("age", e.fieldName());
	}

	@Test
	void nullData_reportsFirstField() {
		MissingFieldException e = assertThrows(MissingFieldException.class,
			() -> validator.validateData("users", null));
		assertEquals("name", e.fieldName());
	}

	@Test
	void failedPredicate() {
		PredicateFailedException e = assertThrows(PredicateFailedException.class,
			() -> validator.validateData("users", ObservedObject.of(Map.of("name", "alice", "age", -1))));
		assertEquals("Validation Error: age must be non-negative - -1", e.getMessage());
		assertEquals(-1, e.value());
	}

	@Test
	void fieldsAreCheckedInOrder() {
		PredicateFailedException e = assertThrows(PredicateFailedException.class,
			() -> validator.validateData("users", ObservedObject.of(Map.of("name", 5, "age", -1))));
		assertEquals("name", e.fieldName());
	}

	@Test
	void asyncPredicate_isAwaited() {
		validator.register("async", Schema.builder()
			.asyncField("code", v -> CompletableFuture.supplyAsync(() -> "ok".equals(v)), "code must be ok")
			.build());
		assertDoesNotThrow(() -> validator.validateData("async", ObservedObject.of(Map.of("code", "ok"))));
		assertThrows(PredicateFailedException.class,
			() -> validator.validateData("async", ObservedObject.of(Map.of("code", "bad"))));
	}

	@Test
	void throwingPredicate_isReportedWithCause() {
		IllegalStateException failure = new IllegalStateException("Predicate failure");
		validator.register("throws", Schema.builder()
			.field("x", v -> { throw failure; }, "x is broken")
			.asyncField("y", v -> CompletableFuture.failedFuture(failure), "y is broken")
			.build());
		PredicateFailedException e = assertThrows(PredicateFailedException.class,
			() -> validator.validateData("throws", ObservedObject.of(Map.of("x", 1, "y", 2))));
		assertEquals("x", e.fieldName());
		assertEquals(failure, e.getCause());

		validator.register("throws", Schema.builder()
			.asyncField("y", v -> CompletableFuture.failedFuture(failure), "y is broken")
			.build());
		e = assertThrows(PredicateFailedException.class,
			() -> validator.validateData("throws", ObservedObject.of(Map.of("y", 2))));
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}

	@Test
	void register_replacesSchema() {
		validator.register("users", Schema.builder().build());
		assertDoesNotThrow(() -> validator.validateData("users", new ObservedObject()));
	}
}
