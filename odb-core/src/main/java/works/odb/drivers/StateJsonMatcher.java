package works.odb.drivers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.BooleanNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.NumericNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.odb.Query;
import works.odb.StateDocument;

/**
 * Evaluates {@link Query queries} against a document's state JSON,
 * for drivers whose backend can't do it for them.
 * <p>
 * A dotted key walks nested objects. Numbers match by numeric value regardless of
 * representation, so {@code 1}, {@code 1L} and {@code 1.0} are all equal.
 * A null expected value matches an explicit null or a missing field.
 */
public final class StateJsonMatcher {
	public static final String STATE_JSON_PREFIX = StateDocument.STATE_JSON + ".";

	private StateJsonMatcher() { }

	/**
	 * @return {@code query} with every key addressing a field inside the stored state JSON
	 */
	public static Query prefixed(Query query) {
		return query.withKeys(k -> STATE_JSON_PREFIX + k);
	}

	/**
	 * Undoes {@link #prefixed}. Keys without the prefix are left alone.
	 */
	public static Query unprefixed(Query query) {
		return query.withKeys(StateJsonMatcher::stripPrefix);
	}

	public static String stripPrefix(String key) {
		if (key.startsWith(STATE_JSON_PREFIX)) {
			return key.substring(STATE_JSON_PREFIX.length());
		} else {
			return key;
		}
	}

	public static boolean matches(JsonNode stateJson, Query query) {
		for (Map.Entry<String, Object> entry : query.fields().entrySet()) {
			if (!valueMatches(resolve(stateJson, entry.getKey()), entry.getValue())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the node at {@code dottedPath}, or null if there's none
	 */
	static JsonNode resolve(JsonNode root, String dottedPath) {
		JsonNode current = root;
		for (String segment : dottedPath.split("\\.", -1)) {
			if (current instanceof ObjectNode object) {
				current = object.get(segment);
			} else {
				return null;
			}
		}
		return current;
	}

	static boolean valueMatches(JsonNode actual, Object expected) {
		if (expected == null) {
			return actual == null || actual instanceof NullNode;
		} else if (expected instanceof String s) {
			return actual instanceof StringNode text && s.equals(text.asString());
		} else if (expected instanceof Boolean b) {
			return actual instanceof BooleanNode bool && b == bool.booleanValue();
		} else if (expected instanceof Number n) {
			BigDecimal expectedDecimal = toBigDecimal(n);
			return expectedDecimal != null
				&& actual instanceof NumericNode number
				&& !number.isNaN()
				&& number.decimalValue().compareTo(expectedDecimal) == 0;
		} else {
			return false;
		}
	}

	/**
	 * @return null for NaN and infinities, which match nothing
	 */
	private static BigDecimal toBigDecimal(Number n) {
		if (n instanceof BigDecimal d) {
			return d;
		} else if (n instanceof BigInteger i) {
			return new BigDecimal(i);
		} else if (n instanceof Double || n instanceof Float) {
			double d = n.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return null;
			}
			return BigDecimal.valueOf(d);
		} else {
			return BigDecimal.valueOf(n.longValue());
		}
	}
}
