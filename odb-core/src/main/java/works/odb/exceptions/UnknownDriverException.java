package works.odb.exceptions;

/**
 * Thrown when an operation names a driver that is not registered,
 * either because it was never declared, was not eligible in this environment,
 * or failed to initialize.
 */
public class UnknownDriverException extends IllegalArgumentException {
	private final String driverName;

	public UnknownDriverException(String driverName) {
		super("Unknown driver \"" + driverName + "\"");
		this.driverName = driverName;
	}

	public String driverName() {
		return driverName;
	}
}
