package works.odb;

import tools.jackson.databind.JsonNode;

/**
 * The pair of representations every driver persists for a document.
 *
 * @param stateTree tagged structural snapshot from which the live object is rebuilt
 * @param stateJson plain JSON projection of the same state, used only for equality filtering
 */
public record StateDocument(
	JsonNode stateTree,
	JsonNode stateJson
) {
	public static final String STATE_TREE = "state_tree";
	public static final String STATE_JSON = "state_json";
}
