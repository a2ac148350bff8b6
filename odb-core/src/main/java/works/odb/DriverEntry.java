package works.odb;

import static java.util.Objects.requireNonNull;

/**
 * One row of the table of drivers an {@link OdbContext} can initialize.
 *
 * @param name the name callers use to select the driver
 * @param environment where the driver runs; outside {@link OdbProperties#test() test mode},
 *                    only drivers for the current environment are initialized
 */
public record DriverEntry(
	String name,
	Environment environment,
	DriverFactory factory
) {
	public DriverEntry {
		requireNonNull(name);
		requireNonNull(environment);
		requireNonNull(factory);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Driver name can't be empty");
		}
	}

	/**
	 * @return whether this driver should be initialized for the given properties
	 */
	public boolean isEligible(OdbProperties props) {
		if (!props.drivers().isEmpty() && !props.drivers().contains(name)) {
			return false;
		}
		return props.test() || props.environment() == environment;
	}
}
