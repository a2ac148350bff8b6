package works.odb;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.odb.drivers.OdbDriver;
import works.odb.drivers.QueryTransformingDriver;
import works.odb.exceptions.MalformedDocumentException;
import works.odb.exceptions.UnknownDriverException;
import works.odb.exceptions.ValidationException;
import works.odb.logging.MappedDiagnosticContext.MDCScope;
import works.odb.state.Mutation;
import works.odb.state.ObservedObject;

import static works.odb.logging.MappedDiagnosticContext.setupMDC;

/**
 * Keeps live objects in sync with stored documents.
 * <p>
 * {@link #open Open} a document to get an {@link ObservedObject};
 * from then on, every change to that object is validated against the collection's
 * {@link Schema} and, if valid, written to the driver in the background.
 * There are no explicit save calls.
 * <p>
 * Lifecycle: {@link #init}, then any number of {@link #open} and {@link #remove} calls,
 * then {@link #close}. A closed {@code Odb} can be initialized again.
 */
public class Odb implements AutoCloseable {
	private final OdbContext context;

	public Odb(OdbContext context) {
		this.context = context;
	}

	public OdbContext context() {
		return context;
	}

	public Validator validator() {
		return context.validator();
	}

	/**
	 * Builds the drivers selected by {@code props}, and starts accepting persistence tasks.
	 *
	 * @return for each eligible driver, whether it is available
	 * @see DriverRegistry#init
	 */
	public Map<String, Boolean> init(OdbProperties props) {
		try (MDCScope __ = setupMDC(context.name(), context.instanceID())) {
			context.watchers().start();
			Map<String, Boolean> result = context.registry().init(props);
			LOGGER.info("Initialized: {}", result);
			return result;
		}
	}

	/**
	 * Finds or creates a document and returns a live object bound to it.
	 * <ul>
	 *     <li>With an empty query, a new document is created from {@code value}
	 *         (or an empty object, if {@code value} is null).</li>
	 *     <li>Otherwise, the first document matching {@code query} is used;
	 *         if none matches, a new one is created from {@code value},
	 *         unless {@code value} is null, in which case the result is empty.</li>
	 * </ul>
	 * The returned object is always a new instance decoded from the stored document,
	 * never {@code value} itself.
	 *
	 * @param query null is treated as {@link Query#empty()}
	 * @param value the initial state for a new document; may be null
	 * @return the live object, or empty if {@code value} is invalid or no document was found
	 * @throws UnknownDriverException if {@code driverName} is not registered
	 * @throws MalformedDocumentException if the driver returns a document without an id or a valid state tree
	 */
	public Optional<ObservedObject> open(String driverName, String collection, Query query, ObservedObject value) {
		try (MDCScope __ = setupMDC(context.name(), context.instanceID(), driverName, collection)) {
			OdbDriver driver = context.registry().driver(driverName);
			// The value that's validated is the one that's stored
			ObservedObject initial = (value == null) ? null : value.detachedCopy();
			try {
				context.validator().validateData(collection, initial);
			} catch (ValidationException e) {
				LOGGER.warn("Rejected initial value: {}", e.getMessage());
				return Optional.empty();
			}

			Query nativeQuery = nativeQuery(driver, query == null ? Query.empty() : query);
			Document document;
			if (nativeQuery.isEmpty()) {
				ObservedObject created = (initial == null) ? new ObservedObject() : initial;
				document = driver.create(collection, context.codec().stateDocument(created));
				LOGGER.debug("Created document");
			} else {
				Optional<Document> found = driver.query(collection, nativeQuery);
				if (found.isPresent()) {
					document = found.get();
					LOGGER.debug("Found document for {}", nativeQuery);
				} else if (initial != null) {
					document = driver.create(collection, context.codec().stateDocument(initial));
					LOGGER.debug("No document for {}; created one", nativeQuery);
				} else {
					LOGGER.debug("No document for {}", nativeQuery);
					return Optional.empty();
				}
			}

			checkShape(document, driverName);
			ObservedObject live = context.codec().decode(document.stateTree());
			watch(driver, driverName, collection, document.id(), live);
			return Optional.of(live);
		}
	}

	/**
	 * Creates a new document from {@code value}.
	 */
	public Optional<ObservedObject> open(String driverName, String collection, ObservedObject value) {
		return open(driverName, collection, Query.empty(), value);
	}

	/**
	 * Looks up an existing document without creating one.
	 */
	public Optional<ObservedObject> open(String driverName, String collection, Query query) {
		return open(driverName, collection, query, null);
	}

	/**
	 * Deletes the first document matching {@code query}. An empty query matches any document.
	 * <p>
	 * Live objects already bound to the document are unaffected, but their writes will fail.
	 *
	 * @return true if a document was removed; false if none matched or the driver failed
	 * @throws UnknownDriverException if {@code driverName} is not registered
	 */
	public boolean remove(String driverName, String collection, Query query) {
		try (MDCScope __ = setupMDC(context.name(), context.instanceID(), driverName, collection)) {
			OdbDriver driver = context.registry().driver(driverName);
			try {
				Query nativeQuery = nativeQuery(driver, query == null ? Query.empty() : query);
				Optional<Document> found = driver.query(collection, nativeQuery);
				if (found.isEmpty()) {
					LOGGER.debug("Nothing to remove for {}", nativeQuery);
					return false;
				}
				DocumentId id = found.get().id();
				boolean result = driver.remove(collection, id);
				LOGGER.debug("Remove {}: {}", id, result);
				return result;
			} catch (RuntimeException e) {
				LOGGER.error("Unable to remove document matching {}", query, e);
				return false;
			}
		}
	}

	/**
	 * Waits for all persistence tasks scheduled so far to finish.
	 * Useful when another process needs to see the stored state.
	 */
	public void flush() {
		context.watchers().flush();
	}

	/**
	 * Closes all drivers, then cancels all watchers.
	 * Doesn't wait for writes already in progress.
	 */
	@Override
	public void close() {
		try (MDCScope __ = setupMDC(context.name(), context.instanceID())) {
			LOGGER.info("Shutting down");
			context.registry().close();
			context.watchers().closeAll();
		}
	}

	private static Query nativeQuery(OdbDriver driver, Query query) {
		if (driver instanceof QueryTransformingDriver t) {
			return t.transformQuery(query);
		} else {
			return query;
		}
	}

	private static void checkShape(Document document, String driverName) {
		if (document == null) {
			throw new MalformedDocumentException("Driver \"" + driverName + "\" returned no document");
		} else if (document.id() == null) {
			throw new MalformedDocumentException("Driver \"" + driverName + "\" returned a document with no id");
		} else if (document.stateTree() == null) {
			throw new MalformedDocumentException("Driver \"" + driverName + "\" returned document " + document.id() + " with no state tree");
		}
	}

	private void watch(OdbDriver driver, String driverName, String collection, DocumentId id, ObservedObject live) {
		WatcherHandle handle = new WatcherHandle(driverName, collection, id, live);
		handle.start(mutation -> context.watchers().submit(() -> persist(driver, handle, mutation)));
		context.watchers().track(handle);
		LOGGER.debug("Watching {}", handle);
	}

	private void persist(OdbDriver driver, WatcherHandle handle, Mutation mutation) {
		try (MDCScope __ = setupMDC(context.name(), context.instanceID(), handle.driverName(), handle.collection(), handle.id())) {
			if (handle.isCancelled()) {
				LOGGER.debug("Watcher cancelled; ignoring {}", mutation);
				return;
			}
			// Validate and store the same copy
			ObservedObject state = handle.value().detachedCopy();
			try {
				context.validator().validateData(handle.collection(), state);
			} catch (ValidationException e) {
				handle.recordSkipped();
				LOGGER.warn("Not persisting invalid state after {}: {}", mutation.path(), e.getMessage());
				return;
			}
			try {
				StateDocument doc = context.codec().stateDocument(state);
				if (driver.update(handle.collection(), handle.id(), doc)) {
					handle.recordPersisted();
					LOGGER.debug("Persisted {}", mutation.path());
				} else {
					handle.recordFailed();
					LOGGER.error("Document {} no longer exists", handle.id());
				}
			} catch (RuntimeException e) {
				handle.recordFailed();
				LOGGER.error("Unable to persist {}", handle, e);
			}
		}
	}

	@Override
	public String toString() {
		return "Odb{" + context.instanceID() + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Odb.class);
}
