package works.odb.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.BooleanNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.NumericNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.odb.exceptions.MalformedDocumentException;
import works.odb.state.ObservedArray;
import works.odb.state.ObservedContainer;
import works.odb.state.ObservedObject;

/**
 * Encodes each container as a two-field object naming its type:
 * <pre>
 * {"@type": "ObservedObject", "value": {...}}
 * {"@type": "ObservedArray",  "value": [...]}
 * </pre>
 * Scalars are stored as plain JSON.
 */
public final class TaggedStateCodec implements StateCodec {
	public static final String TYPE_FIELD = "@type";
	public static final String VALUE_FIELD = "value";
	public static final String OBJECT_TAG = "ObservedObject";
	public static final String ARRAY_TAG = "ObservedArray";

	private final JsonNodeFactory nodes = JsonNodeFactory.instance;

	@Override
	public JsonNode encodeTree(ObservedObject value) {
		return taggedContainer(value);
	}

	@Override
	public JsonNode encodeJson(ObservedObject value) {
		return plainNode(value.toPlainValue());
	}

	@Override
	public ObservedObject decode(JsonNode stateTree) {
		if (decodeTagged(stateTree, "") instanceof ObservedObject result) {
			return result;
		} else {
			throw new MalformedDocumentException("State tree root must be a tagged " + OBJECT_TAG);
		}
	}

	private ObjectNode taggedContainer(ObservedContainer container) {
		ObjectNode result = nodes.objectNode();
		if (container instanceof ObservedObject object) {
			result.put(TYPE_FIELD, OBJECT_TAG);
			ObjectNode fields = result.putObject(VALUE_FIELD);
			object.snapshot().forEach((k, v) -> fields.set(k, taggedNode(v)));
		} else {
			result.put(TYPE_FIELD, ARRAY_TAG);
			ArrayNode elements = result.putArray(VALUE_FIELD);
			((ObservedArray) container).snapshot().forEach(v -> elements.add(taggedNode(v)));
		}
		return result;
	}

	private JsonNode taggedNode(Object value) {
		if (value instanceof ObservedContainer container) {
			return taggedContainer(container);
		} else {
			return scalarNode(value);
		}
	}

	private JsonNode plainNode(Object value) {
		if (value instanceof Map<?, ?> map) {
			ObjectNode result = nodes.objectNode();
			map.forEach((k, v) -> result.set((String) k, plainNode(v)));
			return result;
		} else if (value instanceof List<?> list) {
			ArrayNode result = nodes.arrayNode();
			list.forEach(v -> result.add(plainNode(v)));
			return result;
		} else {
			return scalarNode(value);
		}
	}

	private JsonNode scalarNode(Object value) {
		if (value == null) {
			return nodes.nullNode();
		} else if (value instanceof String s) {
			return nodes.stringNode(s);
		} else if (value instanceof Boolean b) {
			return nodes.booleanNode(b);
		} else if (value instanceof Integer i) {
			return nodes.numberNode(i);
		} else if (value instanceof Long l) {
			return nodes.numberNode(l);
		} else if (value instanceof Double d) {
			return nodes.numberNode(d);
		} else if (value instanceof BigDecimal d) {
			return nodes.numberNode(d);
		} else if (value instanceof BigInteger i) {
			return nodes.numberNode(i);
		} else {
			throw new IllegalArgumentException("Unexpected value type: " + value.getClass().getName());
		}
	}

	/**
	 * @param path for error messages
	 */
	private Object decodeTagged(JsonNode node, String path) {
		if (node == null || node instanceof NullNode) {
			return null;
		} else if (node instanceof StringNode s) {
			return s.asString();
		} else if (node instanceof BooleanNode b) {
			return b.booleanValue();
		} else if (node instanceof NumericNode n) {
			return n.numberValue();
		} else if (node instanceof ObjectNode object) {
			return decodeContainer(object, path);
		} else {
			throw new MalformedDocumentException("Unexpected " + node.getNodeType() + " node at \"" + path + "\"");
		}
	}

	private ObservedContainer decodeContainer(ObjectNode node, String path) {
		JsonNode tag = node.get(TYPE_FIELD);
		JsonNode value = node.get(VALUE_FIELD);
		if (!(tag instanceof StringNode) || value == null || node.size() != 2) {
			throw new MalformedDocumentException("Expected tagged container at \"" + path + "\"");
		}
		String tagName = tag.asString();
		if (OBJECT_TAG.equals(tagName) && value instanceof ObjectNode fields) {
			ObservedObject result = new ObservedObject();
			for (Map.Entry<String, JsonNode> field : fields.properties()) {
				result.put(field.getKey(), decodeTagged(field.getValue(), path + "/" + field.getKey()));
			}
			return result;
		} else if (ARRAY_TAG.equals(tagName) && value instanceof ArrayNode elements) {
			ObservedArray result = new ObservedArray();
			for (int i = 0; i < elements.size(); i++) {
				result.add(decodeTagged(elements.get(i), path + "/" + i));
			}
			return result;
		} else {
			throw new MalformedDocumentException("Unknown container tag \"" + tagName + "\" at \"" + path + "\"");
		}
	}
}
