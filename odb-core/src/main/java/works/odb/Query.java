package works.odb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A flat field-equality filter: every entry must match the document's
 * {@link StateDocument#stateJson() state JSON} for the document to be selected.
 * <p>
 * Keys may be dotted paths into nested objects.
 * Values are limited to {@code null}, {@link String}, {@link Number} and {@link Boolean}.
 * <p>
 * Instances are immutable and preserve insertion order.
 */
public final class Query {
	private final Map<String, Object> fields;

	private Query(Map<String, Object> fields) {
		this.fields = Collections.unmodifiableMap(fields);
	}

	public static Query empty() {
		return EMPTY;
	}

	public static Query of(String field, Object value) {
		return empty().with(field, value);
	}

	public static Query of(String field1, Object value1, String field2, Object value2) {
		return empty().with(field1, value1).with(field2, value2);
	}

	public static Query from(Map<String, ?> fields) {
		Query result = empty();
		for (Map.Entry<String, ?> entry : fields.entrySet()) {
			result = result.with(entry.getKey(), entry.getValue());
		}
		return result;
	}

	public Query with(String field, Object value) {
		if (field == null || field.isEmpty()) {
			throw new IllegalArgumentException("Query field name can't be empty");
		}
		if (!(value == null || value instanceof String || value instanceof Number || value instanceof Boolean)) {
			throw new IllegalArgumentException("Unsupported query value for field \"" + field + "\": " + value.getClass().getSimpleName());
		}
		LinkedHashMap<String, Object> newFields = new LinkedHashMap<>(fields);
		newFields.put(field, value);
		return new Query(newFields);
	}

	/**
	 * @return a query with the same values whose keys have been rewritten by {@code keyMapper};
	 * used by drivers to express a query in their native form.
	 */
	public Query withKeys(UnaryOperator<String> keyMapper) {
		LinkedHashMap<String, Object> newFields = new LinkedHashMap<>();
		fields.forEach((k, v) -> newFields.put(keyMapper.apply(k), v));
		return new Query(newFields);
	}

	public Map<String, Object> fields() {
		return fields;
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return fields.equals(((Query) o).fields);
	}

	@Override
	public int hashCode() {
		return fields.hashCode();
	}

	@Override
	public String toString() {
		return "Query" + fields;
	}

	private static final Query EMPTY = new Query(new LinkedHashMap<>());
}
