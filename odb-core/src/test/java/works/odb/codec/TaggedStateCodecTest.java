package works.odb.codec;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.odb.StateDocument;
import works.odb.exceptions.MalformedDocumentException;
import works.odb.state.ObservedObject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaggedStateCodecTest {
	final TaggedStateCodec codec = new TaggedStateCodec();
	final ObjectMapper mapper = JsonMapper.builder().build();

	@Test
	void encodeTree_tagsEveryContainer() {
		ObservedObject value = ObservedObject.of(Map.of("tags", List.of("x")));
		JsonNode expected = mapper.readTree("""
			{"@type": "ObservedObject", "value": {
				"tags": {"@type": "ObservedArray", "value": ["x"]}
			}}""");
		assertEquals(expected, codec.encodeTree(value));
	}

	@Test
	void encodeJson_isPlain() {
		ObservedObject value = ObservedObject.of(Map.of("tags", List.of("x"), "n", 1));
		JsonNode expected = mapper.readTree("""
			{"tags": ["x"], "n": 1}""");
		assertEquals(expected, codec.encodeJson(value));
	}

	@Test
	void stateDocument_bothFormsComeFromOneSnapshot() {
		ObservedObject live = ObservedObject.of(Map.of("status", "draft"));
		StateCodec changingCodec = new StateCodec() {
			@Override
			public JsonNode encodeTree(ObservedObject value) {
				JsonNode result = codec.encodeTree(value);
				live.put("status", "published");
				return result;
			}

			@Override
			public JsonNode encodeJson(ObservedObject value) {
				return codec.encodeJson(value);
			}

			@Override
			public ObservedObject decode(JsonNode stateTree) {
				return codec.decode(stateTree);
			}
		};
		StateDocument doc = changingCodec.stateDocument(live);
		assertEquals("draft", codec.decode(doc.stateTree()).get("status"));
		assertEquals("draft", doc.stateJson().get("status").asString());
	}

	@Test
	void decode_rebuildsEncodedObject() {
		ObservedObject value = new ObservedObject();
		value.put("name", "alice");
		value.put("age", 30);
		value.put("height", 1.75);
		value.put("active", true);
		value.put("nickname", null);
		value.put("address", Map.of("city", "Ottawa"));
		value.put("scores", List.of(1, 2, List.of(3)));
		ObservedObject decoded = codec.decode(codec.encodeTree(value));
		assertEquals(value.toPlainValue(), decoded.toPlainValue());
	}

	@Test
	void decode_untaggedRoot_throws() {
		assertThrows(MalformedDocumentException.class, () -> codec.decode(mapper.readTree("""
			{"name": "alice"}""")));
		assertThrows(MalformedDocumentException.class, () -> codec.decode(mapper.readTree("""
			{"@type": "ObservedArray", "value": []}""")));
	}

	@Test
	void decode_unknownTag_throws() {
		assertThrows(MalformedDocumentException.class, () -> codec.decode(mapper.readTree("""
			{"@type": "ObservedObject", "value": {
				"child": {"@type": "Mystery", "value": {}}
			}}""")));
	}
}
