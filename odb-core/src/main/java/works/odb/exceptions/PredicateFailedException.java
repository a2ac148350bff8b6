package works.odb.exceptions;

public class PredicateFailedException extends ValidationException {
	private final Object value;

	public PredicateFailedException(String collection, String fieldName, String message, Object value) {
		super(collection, fieldName, fullMessage(message, value));
		this.value = value;
	}

	public PredicateFailedException(String collection, String fieldName, String message, Object value, Throwable cause) {
		super(collection, fieldName, fullMessage(message, value), cause);
		this.value = value;
	}

	/**
	 * @return the value that was rejected
	 */
	public Object value() {
		return value;
	}

	private static String fullMessage(String message, Object value) {
		return "Validation Error: " + message + " - " + value;
	}
}
