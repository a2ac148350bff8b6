package works.odb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The rules a collection's documents must satisfy: each listed field must be present,
 * and its value must satisfy the field's predicate.
 * Fields are checked in the order they were added.
 */
public final class Schema {
	private final Map<String, FieldRule> fields;

	private Schema(Map<String, FieldRule> fields) {
		this.fields = Collections.unmodifiableMap(fields);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Map<String, FieldRule> fields() {
		return fields;
	}

	@Override
	public String toString() {
		return "Schema" + fields.keySet();
	}

	public static class Builder {
		private final Map<String, FieldRule> fields = new LinkedHashMap<>();

		Builder() { }

		public Builder field(String name, FieldRule rule) {
			if (fields.containsKey(name)) {
				throw new IllegalArgumentException("Duplicate field \"" + name + "\"");
			}
			fields.put(name, rule);
			return this;
		}

		public Builder field(String name, Predicate<Object> predicate, String message) {
			return field(name, new FieldRule(FieldPredicate.of(predicate), message));
		}

		/**
		 * Adds a field whose predicate completes asynchronously.
		 */
		public Builder asyncField(String name, FieldPredicate predicate, String message) {
			return field(name, new FieldRule(predicate, message));
		}

		public Schema build() {
			return new Schema(new LinkedHashMap<>(fields));
		}
	}
}
