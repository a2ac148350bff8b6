package works.odb;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import works.odb.exceptions.MissingFieldException;
import works.odb.exceptions.PredicateFailedException;
import works.odb.exceptions.ValidationException;
import works.odb.state.ObservedObject;

/**
 * Holds the {@link Schema} of each collection and checks live objects against them.
 * Collections without a schema accept anything.
 */
public final class Validator {
	private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

	/**
	 * Replaces any schema already registered for {@code collection}.
	 */
	public void register(String collection, Schema schema) {
		schemas.put(collection, schema);
	}

	public Optional<Schema> schemaFor(String collection) {
		return Optional.ofNullable(schemas.get(collection));
	}

	public boolean hasSchema(String collection) {
		return schemas.containsKey(collection);
	}

	/**
	 * Checks each field of the collection's schema in order, stopping at the first violation.
	 * Asynchronous predicates are awaited.
	 *
	 * @param data may be null, in which case the first field of the schema, if any, is reported missing
	 * @throws MissingFieldException if a field is absent from {@code data}
	 * @throws PredicateFailedException if a field's predicate returns false or throws
	 */
	public void validateData(String collection, ObservedObject data) throws ValidationException {
		Schema schema = schemas.get(collection);
		if (schema == null) {
			return;
		}
		for (Map.Entry<String, FieldRule> entry : schema.fields().entrySet()) {
			String field = entry.getKey();
			FieldRule rule = entry.getValue();
			if (data == null || !data.containsKey(field)) {
				throw new MissingFieldException(collection, field);
			}
			Object value = data.get(field);
			boolean isValid;
			try {
				isValid = Boolean.TRUE.equals(rule.predicate().test(value).toCompletableFuture().get());
			} catch (ExecutionException | CompletionException e) {
				throw new PredicateFailedException(collection, field, rule.message(), value, e.getCause());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new PredicateFailedException(collection, field, rule.message(), value, e);
			} catch (RuntimeException e) {
				throw new PredicateFailedException(collection, field, rule.message(), value, e);
			}
			if (!isValid) {
				throw new PredicateFailedException(collection, field, rule.message(), value);
			}
		}
	}
}
