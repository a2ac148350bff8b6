package works.odb.exceptions;

/**
 * Thrown from driver methods when the backing store can't be read or written.
 */
public class PersistenceException extends RuntimeException {
	public PersistenceException(String message) {
		super(message);
	}

	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}

	public PersistenceException(Throwable cause) {
		super(cause);
	}
}
