package works.odb.codec;

import tools.jackson.databind.JsonNode;
import works.odb.StateDocument;
import works.odb.exceptions.MalformedDocumentException;
import works.odb.state.ObservedObject;

/**
 * Converts between live objects and the two JSON forms a driver stores.
 */
public interface StateCodec {
	/**
	 * @return the structural snapshot of {@code value}, from which {@link #decode} can rebuild it
	 */
	JsonNode encodeTree(ObservedObject value);

	/**
	 * @return the plain JSON projection of {@code value}, suitable for field-equality queries
	 */
	JsonNode encodeJson(ObservedObject value);

	/**
	 * @return a new live object equivalent to the one from which {@code stateTree} was encoded
	 * @throws MalformedDocumentException if {@code stateTree} isn't an encoded object
	 */
	ObservedObject decode(JsonNode stateTree);

	/**
	 * Encodes both forms from a single {@link ObservedObject#detachedCopy() copy} of {@code value},
	 * so they agree even if {@code value} changes meanwhile.
	 */
	default StateDocument stateDocument(ObservedObject value) {
		ObservedObject copy = value.detachedCopy();
		return new StateDocument(encodeTree(copy), encodeJson(copy));
	}
}
