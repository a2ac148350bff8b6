package works.odb;

import works.odb.drivers.OdbDriver;

/**
 * Creates the {@link OdbDriver} instance registered under one {@link DriverEntry#name() name}.
 * <p>
 * Called at most once per successful {@link DriverRegistry#init init};
 * a factory that throws leaves its driver unavailable until the next {@code init}.
 * Implementations typically read their settings from {@link OdbProperties#settings()},
 * check that the backend is reachable, and return a ready-to-use driver.
 */
@FunctionalInterface
public interface DriverFactory {
	OdbDriver build(OdbProperties props) throws Exception;
}
