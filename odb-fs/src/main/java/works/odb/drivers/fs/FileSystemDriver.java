package works.odb.drivers.fs;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.DriverEntry;
import works.odb.Environment;
import works.odb.Query;
import works.odb.StateDocument;
import works.odb.drivers.ClosableDriver;
import works.odb.drivers.QueryTransformingDriver;
import works.odb.drivers.StateJsonMatcher;
import works.odb.exceptions.PersistenceException;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static works.odb.StateDocument.STATE_JSON;
import static works.odb.StateDocument.STATE_TREE;

/**
 * Stores each document as a JSON file named {@code <root>/<collection>/<id>.json},
 * holding the fields {@code id}, {@code state_tree} and {@code state_json}.
 * <p>
 * Identifiers are random UUIDs. Queries scan every file in the collection
 * in filename order, so "first match" is stable but otherwise arbitrary.
 * <p>
 * Files are replaced atomically, so readers never see a partially written document.
 * Updates and removals are serialized within one driver instance, so an update
 * never recreates a document that has been removed.
 */
public class FileSystemDriver implements QueryTransformingDriver, ClosableDriver {
	public static final String NAME = "fs";
	public static final String TEST_DIR = "test_data";
	public static final String ID_FIELD = "id";
	static final String SUFFIX = ".json";

	private final FileSystemDriverSettings settings;
	private final Path rootDir;
	private final ObjectMapper mapper = JsonMapper.builder().build();
	private final ObjectWriter writer;
	private final Object updateLock = new Object();

	public FileSystemDriver(FileSystemDriverSettings settings) throws IOException {
		this.settings = settings;
		this.rootDir = settings.rootDir().toAbsolutePath().normalize();
		this.writer = settings.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
		Files.createDirectories(rootDir);
		LOGGER.debug("Using directory {}", rootDir);
	}

	public static DriverEntry entry() {
		return new DriverEntry(NAME, Environment.SERVER, props -> new FileSystemDriver(FileSystemDriverSettings.from(props)));
	}

	public static DriverEntry entry(FileSystemDriverSettings settings) {
		return new DriverEntry(NAME, Environment.SERVER, props -> new FileSystemDriver(settings));
	}

	public Path rootDir() {
		return rootDir;
	}

	@Override
	public Document create(String collection, StateDocument doc) {
		DocumentId id = DocumentId.from(UUID.randomUUID().toString());
		try {
			write(collectionDir(collection), id, doc);
		} catch (IOException e) {
			throw new PersistenceException("Unable to create document in collection \"" + collection + "\"", e);
		}
		LOGGER.debug("Created {}/{}", collection, id);
		return new Document(id, doc.stateTree());
	}

	@Override
	public Optional<Document> query(String collection, Query nativeQuery) {
		Query query = StateJsonMatcher.unprefixed(nativeQuery);
		try {
			for (Path file : documentFiles(collectionDir(collection))) {
				Optional<ObjectNode> contents = read(file);
				if (contents.isPresent() && StateJsonMatcher.matches(contents.get().get(STATE_JSON), query)) {
					return Optional.of(toDocument(file, contents.get()));
				}
			}
		} catch (IOException e) {
			throw new PersistenceException("Unable to query collection \"" + collection + "\"", e);
		}
		return Optional.empty();
	}

	@Override
	public boolean update(String collection, DocumentId id, StateDocument doc) {
		try {
			Path dir = collectionDir(collection);
			Optional<Path> file = documentFile(dir, id);
			synchronized (updateLock) {
				if (file.isEmpty() || !Files.exists(file.get())) {
					LOGGER.debug("No document {}/{} to update", collection, id);
					return false;
				}
				write(dir, id, doc);
			}
			return true;
		} catch (IOException e) {
			throw new PersistenceException("Unable to update document " + id + " in collection \"" + collection + "\"", e);
		}
	}

	@Override
	public boolean remove(String collection, DocumentId id) {
		try {
			Optional<Path> file = documentFile(collectionDir(collection), id);
			synchronized (updateLock) {
				return file.isPresent() && Files.deleteIfExists(file.get());
			}
		} catch (IOException e) {
			throw new PersistenceException("Unable to remove document " + id + " from collection \"" + collection + "\"", e);
		}
	}

	/**
	 * Stored files nest the state JSON under {@code state_json}.
	 */
	@Override
	public Query transformQuery(Query query) {
		return StateJsonMatcher.prefixed(query);
	}

	/**
	 * In test mode, deletes everything this driver stored.
	 */
	@Override
	public void close() throws IOException {
		if (settings.test()) {
			LOGGER.debug("Deleting test directory {}", rootDir);
			deleteRecursively(rootDir);
		}
	}

	private Path collectionDir(String collection) throws IOException {
		if (collection.isEmpty()
			|| collection.contains("/")
			|| collection.contains("\\")
			|| collection.equals(".")
			|| collection.equals("..")) {
			throw new IllegalArgumentException("Invalid collection name \"" + collection + "\"");
		}
		return Files.createDirectories(rootDir.resolve(collection));
	}

	/**
	 * @return empty if {@code id} can't have been issued by this driver
	 */
	private static Optional<Path> documentFile(Path dir, DocumentId id) {
		try {
			UUID uuid = UUID.fromString(id.toString());
			return Optional.of(dir.resolve(uuid + SUFFIX));
		} catch (IllegalArgumentException e) {
			LOGGER.debug("Not a filesystem document ID: \"{}\"", id);
			return Optional.empty();
		}
	}

	private static List<Path> documentFiles(Path dir) throws IOException {
		try (Stream<Path> files = Files.list(dir)) {
			return files
				.filter(f -> f.getFileName().toString().endsWith(SUFFIX))
				.sorted()
				.toList();
		}
	}

	private void write(Path dir, DocumentId id, StateDocument doc) throws IOException {
		ObjectNode contents = mapper.createObjectNode();
		contents.put(ID_FIELD, id.toString());
		contents.set(STATE_TREE, doc.stateTree());
		contents.set(STATE_JSON, doc.stateJson());
		Path temp = Files.createTempFile(dir, id.toString(), ".tmp");
		try {
			try {
				Files.write(temp, writer.writeValueAsBytes(contents));
			} catch (JacksonException e) {
				throw new IOException("Unable to serialize document " + id, e);
			}
			Files.move(temp, dir.resolve(id + SUFFIX), REPLACE_EXISTING, ATOMIC_MOVE);
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	/**
	 * @return empty if the file vanished before it could be read
	 */
	private Optional<ObjectNode> read(Path file) throws IOException {
		JsonNode node;
		try (InputStream in = Files.newInputStream(file)) {
			node = mapper.readTree(in);
		} catch (NoSuchFileException e) {
			LOGGER.debug("File disappeared: {}", file);
			return Optional.empty();
		} catch (JacksonException e) {
			throw new IOException("Unable to parse " + file, e);
		}
		if (node instanceof ObjectNode object) {
			return Optional.of(object);
		} else {
			throw new IOException("Expected a JSON object in " + file);
		}
	}

	private static Document toDocument(Path file, ObjectNode contents) {
		DocumentId id;
		if (contents.get(ID_FIELD) instanceof StringNode idNode) {
			id = DocumentId.from(idNode.asString());
		} else {
			String fileName = file.getFileName().toString();
			id = DocumentId.from(fileName.substring(0, fileName.length() - SUFFIX.length()));
		}
		return new Document(id, contents.get(STATE_TREE));
	}

	private static void deleteRecursively(Path dir) throws IOException {
		if (!Files.exists(dir)) {
			return;
		}
		try (Stream<Path> paths = Files.walk(dir)) {
			paths.sorted(Comparator.reverseOrder()).forEach(p -> {
				try {
					Files.delete(p);
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
		} catch (UncheckedIOException e) {
			throw e.getCause();
		}
	}

	@Override
	public String toString() {
		return "FileSystemDriver{" + rootDir + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemDriver.class);
}
