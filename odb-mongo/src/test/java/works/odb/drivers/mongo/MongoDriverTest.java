package works.odb.drivers.mongo;

import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.Query;
import works.odb.StateDocument;
import works.odb.codec.TaggedStateCodec;
import works.odb.state.ObservedObject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoDriverTest {
	static final String DATABASE = MongoDriverTest.class.getSimpleName();
	static final String COLLECTION = "users";
	private static MongoService mongoService;
	final TaggedStateCodec codec = new TaggedStateCodec();
	MongoDriver driver;

	@BeforeAll
	static void setupMongoConnection() {
		mongoService = new MongoService();
	}

	@AfterAll
	static void closeMongoConnection() {
		mongoService.close();
	}

	@BeforeEach
	void setupDriver() {
		mongoService.client().getDatabase(DATABASE).drop();
		driver = new MongoDriver(mongoService.clientSettings(), MongoDriverSettings.builder()
			.database(DATABASE)
			.build());
	}

	@AfterEach
	void closeDriver() {
		driver.close();
	}

	@Test
	void storedDocumentShape() {
		Document doc = driver.create(COLLECTION, codec.stateDocument(ObservedObject.of(Map.of("name", "alice"))));
		BsonDocument stored = mongoService.client()
			.getDatabase(DATABASE)
			.getCollection(COLLECTION, BsonDocument.class)
			.find()
			.first();
		assertEquals(doc.id().toString(), stored.getObjectId(MongoDriver.ID_FIELD).getValue().toHexString());
		assertEquals(new BsonString("alice"), stored.getDocument("state_json").get("name"));
		assertEquals(new BsonString(TaggedStateCodec.OBJECT_TAG), stored.getDocument("state_tree").get(TaggedStateCodec.TYPE_FIELD));
	}

	@Test
	void queryByStateJson() {
		Document doc = driver.create(COLLECTION, codec.stateDocument(ObservedObject.of(Map.of("name", "alice"))));
		Query query = driver.transformQuery(Query.of("name", "alice"));
		assertEquals(Query.of("state_json.name", "alice"), query);
		assertEquals(doc.id(), driver.query(COLLECTION, query).orElseThrow().id());
		assertEquals(doc.stateTree(), driver.query(COLLECTION, query).orElseThrow().stateTree());
	}

	@Test
	void foreignIds_areNotFound() {
		StateDocument empty = codec.stateDocument(new ObservedObject());
		assertFalse(driver.update(COLLECTION, DocumentId.from("1"), empty));
		assertFalse(driver.remove(COLLECTION, DocumentId.from("not-an-object-id")));
		assertFalse(driver.remove(COLLECTION, DocumentId.from("0123456789abcdef01234567")));
	}

	@Test
	void updateAndRemove() {
		Document doc = driver.create(COLLECTION, codec.stateDocument(ObservedObject.of(Map.of("n", 1))));
		assertTrue(driver.update(COLLECTION, doc.id(), codec.stateDocument(ObservedObject.of(Map.of("n", 2)))));
		assertTrue(driver.query(COLLECTION, driver.transformQuery(Query.of("n", 2))).isPresent());
		assertTrue(driver.remove(COLLECTION, doc.id()));
		assertFalse(driver.remove(COLLECTION, doc.id()));
	}
}
