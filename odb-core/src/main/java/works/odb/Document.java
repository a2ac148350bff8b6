package works.odb;

import tools.jackson.databind.JsonNode;

/**
 * What a driver hands back from {@code create} and {@code query}:
 * the document's identifier and the state tree needed to rebuild the live object.
 * <p>
 * Drivers are expected to fill in both fields;
 * {@link Odb} rejects anything else with a
 * {@link works.odb.exceptions.MalformedDocumentException MalformedDocumentException}.
 */
public record Document(
	DocumentId id,
	JsonNode stateTree
) { }
