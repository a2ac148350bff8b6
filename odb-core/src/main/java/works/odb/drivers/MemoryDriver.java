package works.odb.drivers;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.DriverEntry;
import works.odb.Environment;
import works.odb.Query;
import works.odb.StateDocument;

/**
 * Keeps documents in memory, for clients with no server-side store, and for tests.
 * <p>
 * Identifiers are ascending integers, unique across all collections of one driver,
 * and a query returns the matching document with the lowest identifier.
 * Everything is discarded when the driver is closed.
 */
public class MemoryDriver implements QueryTransformingDriver, ClosableDriver {
	public static final String NAME = "memory";

	private final AtomicLong nextID = new AtomicLong(1);
	private final Map<String, ConcurrentSkipListMap<Long, StateDocument>> collections = new ConcurrentHashMap<>();

	public static DriverEntry entry() {
		return new DriverEntry(NAME, Environment.CLIENT, props -> new MemoryDriver());
	}

	@Override
	public Document create(String collection, StateDocument doc) {
		long id = nextID.getAndIncrement();
		collection(collection).put(id, copy(doc));
		LOGGER.debug("Created {}/{}", collection, id);
		return new Document(DocumentId.from(id), doc.stateTree());
	}

	@Override
	public Optional<Document> query(String collection, Query nativeQuery) {
		return collection(collection).entrySet().stream()
			.filter(e -> StateJsonMatcher.matches(e.getValue().stateJson(), nativeQuery))
			.findFirst()
			.map(e -> new Document(DocumentId.from(e.getKey()), e.getValue().stateTree().deepCopy()));
	}

	@Override
	public boolean update(String collection, DocumentId id, StateDocument doc) {
		Long key = key(id);
		if (key == null) {
			return false;
		}
		StateDocument newDoc = copy(doc);
		return collection(collection).computeIfPresent(key, (k, old) -> newDoc) != null;
	}

	@Override
	public boolean remove(String collection, DocumentId id) {
		Long key = key(id);
		return key != null && collection(collection).remove(key) != null;
	}

	/**
	 * Queries refer directly to state JSON fields.
	 */
	@Override
	public Query transformQuery(Query query) {
		return query;
	}

	@Override
	public void close() {
		LOGGER.debug("Discarding {} collections", collections.size());
		collections.clear();
	}

	private ConcurrentSkipListMap<Long, StateDocument> collection(String name) {
		return collections.computeIfAbsent(name, n -> new ConcurrentSkipListMap<>());
	}

	private static StateDocument copy(StateDocument doc) {
		return new StateDocument(doc.stateTree().deepCopy(), doc.stateJson().deepCopy());
	}

	private static Long key(DocumentId id) {
		try {
			return Long.parseLong(id.toString());
		} catch (NumberFormatException e) {
			LOGGER.debug("Not a memory document ID: \"{}\"", id);
			return null;
		}
	}

	@Override
	public String toString() {
		return "MemoryDriver";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryDriver.class);
}
