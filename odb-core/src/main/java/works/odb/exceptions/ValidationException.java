package works.odb.exceptions;

/**
 * Thrown when a value does not satisfy the schema registered for its collection.
 */
public abstract class ValidationException extends Exception {
	private final String collection;
	private final String fieldName;

	protected ValidationException(String collection, String fieldName, String message) {
		super(message);
		this.collection = collection;
		this.fieldName = fieldName;
	}

	protected ValidationException(String collection, String fieldName, String message, Throwable cause) {
		super(message, cause);
		this.collection = collection;
		this.fieldName = fieldName;
	}

	public String collection() {
		return collection;
	}

	public String fieldName() {
		return fieldName;
	}
}
