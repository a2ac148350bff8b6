package works.odb.drivers;

/**
 * A driver holding resources that must be released at shutdown.
 */
public interface ClosableDriver extends OdbDriver {
	/**
	 * Called once, during {@link works.odb.Odb#close()}. The driver is not used afterward.
	 */
	void close() throws Exception;
}
