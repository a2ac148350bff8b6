package works.odb.drivers;

import java.util.Optional;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.Query;
import works.odb.StateDocument;

/**
 * The contract between {@link works.odb.Odb Odb} and a storage backend.
 * <p>
 * A driver stores documents in named collections. Each document gets an identifier
 * from the driver when it is created, and keeps it for life.
 * Besides the identifier, a driver stores both fields of the {@link StateDocument}:
 * the state tree, which it hands back verbatim, and the state JSON,
 * against which it evaluates {@link Query queries}.
 * <p>
 * Optional capabilities are expressed as sub-interfaces:
 * {@link QueryTransformingDriver} and {@link ClosableDriver}.
 */
public interface OdbDriver {
	/**
	 * Stores a new document.
	 *
	 * @return the new document, whose {@link Document#id() id} is never null
	 */
	Document create(String collection, StateDocument doc);

	/**
	 * @param nativeQuery the query, already {@link QueryTransformingDriver#transformQuery transformed} if applicable.
	 *                    An empty query matches any document.
	 * @return the first matching document, if any
	 */
	Optional<Document> query(String collection, Query nativeQuery);

	/**
	 * Replaces the stored contents of an existing document.
	 *
	 * @return true if a document with the given id existed and was updated
	 */
	boolean update(String collection, DocumentId id, StateDocument doc);

	/**
	 * @return true if a document with the given id existed and was removed
	 */
	boolean remove(String collection, DocumentId id);
}
