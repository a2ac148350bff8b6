package works.odb.drivers.sql;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record3;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.Query;
import works.odb.StateDocument;
import works.odb.drivers.StateJsonMatcher;
import works.odb.drivers.sql.schema.DocumentTable;
import works.odb.exceptions.MalformedDocumentException;
import works.odb.exceptions.PersistenceException;

import static java.util.Objects.requireNonNull;
import static org.jooq.impl.DSL.using;

class SqlDriverImpl implements SqlDriver {
	private final SqlDriverSettings settings;
	private final ConnectionSource connectionSource;
	private final ObjectMapper mapper = JsonMapper.builder().build();
	private final DocumentTable schema;
	private final AtomicBoolean isOpen = new AtomicBoolean(true);

	// jOOQ references
	private final Table<Record> DOCUMENTS;
	private final Field<String> ID;
	private final Field<String> COLLECTION;
	private final Field<String> STATE_TREE;
	private final Field<String> STATE_JSON;

	SqlDriverImpl(SqlDriverSettings settings, ConnectionSource cs) {
		this.settings = requireNonNull(settings);
		requireNonNull(cs);
		this.connectionSource = () -> {
			Connection result = cs.get();
			// Every write commits explicitly
			result.setAutoCommit(false);
			return result;
		};

		this.schema = new DocumentTable(settings.tableName());
		DOCUMENTS = schema.TABLE;
		ID = schema.ID;
		COLLECTION = schema.COLLECTION;
		STATE_TREE = schema.STATE_TREE;
		STATE_JSON = schema.STATE_JSON;

		try (var connection = connectionSource.get()) {
			schema.createTable(connection);
		} catch (SQLException | DataAccessException e) {
			throw new PersistenceException("Unable to create table " + settings.tableName(), e);
		}
		LOGGER.debug("Using table {}", settings.tableName());
	}

	@Override
	public Document create(String collection, StateDocument doc) {
		DocumentId id = DocumentId.from(UUID.randomUUID().toString());
		String stateTree = toJson(doc.stateTree());
		String stateJson = toJson(doc.stateJson());
		try (var connection = connectionSource.get()) {
			using(connection)
				.insertInto(DOCUMENTS).columns(ID, COLLECTION, STATE_TREE, STATE_JSON)
				.values(id.toString(), collection, stateTree, stateJson)
				.execute();
			connection.commit();
		} catch (SQLException | DataAccessException e) {
			throw new PersistenceException("Unable to create document in collection \"" + collection + "\"", e);
		}
		LOGGER.debug("Created {}/{}", collection, id);
		return new Document(id, doc.stateTree());
	}

	@Override
	public Optional<Document> query(String collection, Query nativeQuery) {
		Query query = StateJsonMatcher.unprefixed(nativeQuery);
		try (
			var connection = connectionSource.get();
			var cursor = using(connection)
				.select(ID, STATE_TREE, STATE_JSON)
				.from(DOCUMENTS)
				.where(COLLECTION.eq(collection))
				.orderBy(ID)
				.fetchLazy()
		) {
			for (Record3<String, String, String> r : cursor) {
				String id = r.get(ID);
				if (StateJsonMatcher.matches(parse(id, r.get(STATE_JSON)), query)) {
					return Optional.of(new Document(DocumentId.from(id), parse(id, r.get(STATE_TREE))));
				}
			}
			return Optional.empty();
		} catch (SQLException | DataAccessException e) {
			throw new PersistenceException("Unable to query collection \"" + collection + "\"", e);
		}
	}

	@Override
	public boolean update(String collection, DocumentId id, StateDocument doc) {
		String stateTree = toJson(doc.stateTree());
		String stateJson = toJson(doc.stateJson());
		try (var connection = connectionSource.get()) {
			int count = using(connection)
				.update(DOCUMENTS)
				.set(STATE_TREE, stateTree)
				.set(STATE_JSON, stateJson)
				.where(ID.eq(id.toString()).and(COLLECTION.eq(collection)))
				.execute();
			connection.commit();
			if (count == 0) {
				LOGGER.debug("No document {}/{} to update", collection, id);
			}
			return count > 0;
		} catch (SQLException | DataAccessException e) {
			throw new PersistenceException("Unable to update document " + id + " in collection \"" + collection + "\"", e);
		}
	}

	@Override
	public boolean remove(String collection, DocumentId id) {
		try (var connection = connectionSource.get()) {
			int count = using(connection)
				.deleteFrom(DOCUMENTS)
				.where(ID.eq(id.toString()).and(COLLECTION.eq(collection)))
				.execute();
			connection.commit();
			return count > 0;
		} catch (SQLException | DataAccessException e) {
			throw new PersistenceException("Unable to remove document " + id + " from collection \"" + collection + "\"", e);
		}
	}

	/**
	 * Stored rows hold the state JSON in the {@code state_json} column.
	 */
	@Override
	public Query transformQuery(Query query) {
		return StateJsonMatcher.prefixed(query);
	}

	@Override
	public void close() {
		if (isOpen.getAndSet(false)) {
			if (settings.dropTableOnClose()) {
				LOGGER.debug("Dropping table {}", settings.tableName());
				try (var connection = connectionSource.get()) {
					schema.dropTable(connection);
				} catch (SQLException | DataAccessException e) {
					throw new PersistenceException("Unable to drop table " + settings.tableName(), e);
				}
			} else {
				LOGGER.debug("Closing");
			}
		}
	}

	private String toJson(JsonNode node) {
		try {
			return mapper.writeValueAsString(node);
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Unable to serialize state", e);
		}
	}

	private JsonNode parse(String id, String json) {
		try {
			return mapper.readTree(json);
		} catch (JacksonException e) {
			throw new MalformedDocumentException("Unable to parse stored state of " + id, e);
		}
	}

	@Override
	public String toString() {
		return "SqlDriver{" + settings.tableName() + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlDriverImpl.class);
}
