package works.odb.drivers.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonObjectId;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.DriverEntry;
import works.odb.Environment;
import works.odb.Query;
import works.odb.StateDocument;
import works.odb.drivers.ClosableDriver;
import works.odb.drivers.QueryTransformingDriver;
import works.odb.drivers.StateJsonMatcher;
import works.odb.exceptions.MalformedDocumentException;

import static com.mongodb.client.model.Sorts.ascending;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.odb.StateDocument.STATE_JSON;
import static works.odb.StateDocument.STATE_TREE;

/**
 * Stores each document in a MongoDB collection of the same name, in the form
 * <pre>
 * {_id: ObjectId, state_tree: {...}, state_json: {...}}
 * </pre>
 * Queries are evaluated by the server against {@code state_json},
 * which supports dotted paths and numeric comparison natively.
 * <p>
 * Numbers pass through BSON, so decimals become doubles.
 */
public class MongoDriver implements QueryTransformingDriver, ClosableDriver {
	public static final String NAME = "mongodb";
	public static final String ID_FIELD = "_id";

	private final MongoDriverSettings settings;
	private final MongoClient client;
	private final MongoDatabase database;
	private final ObjectMapper mapper = JsonMapper.builder().build();
	private final JsonWriterSettings jsonWriterSettings = JsonWriterSettings.builder()
		.outputMode(JsonMode.RELAXED)
		.build();

	/**
	 * Connects and checks that the server responds.
	 *
	 * @throws com.mongodb.MongoException if the server can't be reached
	 */
	public MongoDriver(MongoClientSettings clientSettings, MongoDriverSettings settings) {
		settings.validate();
		this.settings = settings;
		this.client = MongoClients.create(clientSettings);
		try {
			this.database = client.getDatabase(settings.database());
			database.runCommand(new BsonDocument("ping", new BsonInt32(1)));
		} catch (RuntimeException e) {
			client.close();
			throw e;
		}
		LOGGER.debug("Connected to database \"{}\"", settings.database());
	}

	/**
	 * Connects to {@value MongoDriverSettings#URI}, which must be present in the settings.
	 */
	public static DriverEntry entry() {
		return new DriverEntry(NAME, Environment.SERVER, props -> {
			String uri = props.setting(MongoDriverSettings.URI)
				.orElseThrow(() -> new IllegalArgumentException("Missing setting " + MongoDriverSettings.URI));
			MongoDriverSettings settings = MongoDriverSettings.from(props);
			return new MongoDriver(clientSettings(new ConnectionString(uri), settings), settings);
		});
	}

	public static DriverEntry entry(MongoClientSettings clientSettings, MongoDriverSettings settings) {
		return new DriverEntry(NAME, Environment.SERVER, props -> new MongoDriver(clientSettings, settings));
	}

	public static MongoClientSettings clientSettings(ConnectionString connectionString, MongoDriverSettings settings) {
		return MongoClientSettings.builder()
			.applyConnectionString(connectionString)
			.applyToClusterSettings(builder -> builder.serverSelectionTimeout(settings.serverSelectionTimeoutMS(), MILLISECONDS))
			.build();
	}

	@Override
	public Document create(String collection, StateDocument doc) {
		ObjectId objectId = new ObjectId();
		BsonDocument document = toBson(doc);
		document.put(ID_FIELD, new BsonObjectId(objectId));
		collection(collection).insertOne(document);
		LOGGER.debug("Created {}/{}", collection, objectId);
		return new Document(DocumentId.from(objectId.toHexString()), doc.stateTree());
	}

	@Override
	public Optional<Document> query(String collection, Query nativeQuery) {
		BsonDocument found = collection(collection)
			.find(filter(nativeQuery))
			.sort(ascending(ID_FIELD))
			.first();
		if (found == null) {
			return Optional.empty();
		}
		return Optional.of(new Document(idOf(found), stateTreeOf(found)));
	}

	@Override
	public boolean update(String collection, DocumentId id, StateDocument doc) {
		Optional<ObjectId> objectId = objectId(id);
		if (objectId.isEmpty()) {
			return false;
		}
		return collection(collection)
			.replaceOne(Filters.eq(ID_FIELD, objectId.get()), toBson(doc))
			.getMatchedCount() > 0;
	}

	@Override
	public boolean remove(String collection, DocumentId id) {
		Optional<ObjectId> objectId = objectId(id);
		if (objectId.isEmpty()) {
			return false;
		}
		return collection(collection)
			.deleteOne(Filters.eq(ID_FIELD, objectId.get()))
			.getDeletedCount() > 0;
	}

	/**
	 * Stored documents nest the state JSON under {@code state_json}.
	 */
	@Override
	public Query transformQuery(Query query) {
		return StateJsonMatcher.prefixed(query);
	}

	@Override
	public void close() {
		LOGGER.debug("Closing client for database \"{}\"", settings.database());
		client.close();
	}

	private MongoCollection<BsonDocument> collection(String name) {
		return database.getCollection(name, BsonDocument.class);
	}

	private static Bson filter(Query query) {
		if (query.isEmpty()) {
			return new BsonDocument();
		}
		List<Bson> conditions = new ArrayList<>();
		for (Map.Entry<String, Object> entry : query.fields().entrySet()) {
			conditions.add(Filters.eq(entry.getKey(), entry.getValue()));
		}
		return Filters.and(conditions);
	}

	private BsonDocument toBson(StateDocument doc) {
		BsonDocument result = new BsonDocument();
		result.put(STATE_TREE, toBson(doc.stateTree()));
		result.put(STATE_JSON, toBson(doc.stateJson()));
		return result;
	}

	private BsonDocument toBson(JsonNode node) {
		try {
			return BsonDocument.parse(mapper.writeValueAsString(node));
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Unable to serialize state", e);
		}
	}

	private JsonNode stateTreeOf(BsonDocument found) {
		BsonValue stateTree = found.get(STATE_TREE);
		if (stateTree == null || !stateTree.isDocument()) {
			// Let Odb report the missing state tree
			return null;
		}
		try {
			return mapper.readTree(stateTree.asDocument().toJson(jsonWriterSettings));
		} catch (JacksonException e) {
			throw new MalformedDocumentException("Unable to parse state tree of " + found.get(ID_FIELD), e);
		}
	}

	private static DocumentId idOf(BsonDocument found) {
		BsonValue id = found.get(ID_FIELD);
		if (id != null && id.isObjectId()) {
			return DocumentId.from(id.asObjectId().getValue().toHexString());
		} else {
			return null;
		}
	}

	private static Optional<ObjectId> objectId(DocumentId id) {
		String hex = id.toString();
		if (ObjectId.isValid(hex)) {
			return Optional.of(new ObjectId(hex));
		} else {
			LOGGER.debug("Not a MongoDB document ID: \"{}\"", id);
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return "MongoDriver{" + settings.database() + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoDriver.class);
}
