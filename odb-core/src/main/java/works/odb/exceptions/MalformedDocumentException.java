package works.odb.exceptions;

/**
 * Thrown when a driver hands back a document lacking the fields every
 * document must have. This is a driver bug, so nothing catches it.
 */
public class MalformedDocumentException extends IllegalStateException {
	public MalformedDocumentException(String s) { super(s); }
	public MalformedDocumentException(String message, Throwable cause) { super(message, cause); }
}
