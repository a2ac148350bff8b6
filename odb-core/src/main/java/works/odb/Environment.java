package works.odb;

/**
 * Where a driver is able to run.
 * A {@link DriverRegistry} only initializes drivers declared for the environment
 * it is running in, unless {@link OdbProperties#test() test mode} is on.
 */
public enum Environment {
	/**
	 * Backends that need a server process, such as databases reached over the network
	 * or the local filesystem.
	 */
	SERVER,

	/**
	 * Backends that live inside the application process, the way a browser
	 * key-value store lives inside a web page.
	 */
	CLIENT,
}
