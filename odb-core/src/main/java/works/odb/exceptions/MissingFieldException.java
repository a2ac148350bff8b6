package works.odb.exceptions;

public class MissingFieldException extends ValidationException {
	public MissingFieldException(String collection, String fieldName) {
		super(collection, fieldName, "Validation Error: Missing field '" + fieldName + "' in collection '" + collection + "'.");
	}
}
