package works.odb;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.odb.drivers.ClosableDriver;
import works.odb.drivers.OdbDriver;
import works.odb.exceptions.UnknownDriverException;

/**
 * Builds and holds the drivers of one {@link OdbContext}.
 * <p>
 * The set of possible drivers is fixed when the registry is constructed;
 * {@link #init} decides which of them are actually built.
 * A driver, once built, stays registered until {@link #close}.
 */
public final class DriverRegistry {
	private final List<DriverEntry> entries;
	private final Map<String, OdbDriver> drivers = new ConcurrentHashMap<>();

	public DriverRegistry(List<DriverEntry> entries) {
		Set<String> names = new HashSet<>();
		for (DriverEntry entry : entries) {
			if (!names.add(entry.name())) {
				throw new IllegalArgumentException("Duplicate driver name \"" + entry.name() + "\"");
			}
		}
		this.entries = List.copyOf(entries);
	}

	public List<DriverEntry> entries() {
		return entries;
	}

	/**
	 * Builds every {@link DriverEntry#isEligible eligible} driver that isn't already registered.
	 * Each driver is built independently; a failure is logged and doesn't affect the others.
	 *
	 * @return for each eligible driver, in table order, whether it is now available
	 */
	public Map<String, Boolean> init(OdbProperties props) {
		Map<String, Boolean> result = new LinkedHashMap<>();
		for (DriverEntry entry : entries) {
			if (!entry.isEligible(props)) {
				LOGGER.debug("Skipping driver \"{}\" for {}", entry.name(), entry.environment());
				continue;
			}
			if (drivers.containsKey(entry.name())) {
				LOGGER.debug("Driver \"{}\" already registered", entry.name());
				result.put(entry.name(), true);
				continue;
			}
			try {
				OdbDriver driver = entry.factory().build(props);
				if (driver == null) {
					throw new IllegalStateException("Factory returned null");
				}
				drivers.put(entry.name(), driver);
				LOGGER.info("Registered driver \"{}\": {}", entry.name(), driver);
				result.put(entry.name(), true);
			} catch (Exception e) {
				LOGGER.warn("Unable to initialize driver \"{}\"", entry.name(), e);
				result.put(entry.name(), false);
			}
		}
		return result;
	}

	/**
	 * @throws UnknownDriverException if no driver is registered under {@code name}
	 */
	public OdbDriver driver(String name) {
		OdbDriver result = (name == null) ? null : drivers.get(name);
		if (result == null) {
			throw new UnknownDriverException(name);
		}
		return result;
	}

	public boolean isRegistered(String name) {
		return name != null && drivers.containsKey(name);
	}

	public Set<String> registeredNames() {
		return Set.copyOf(drivers.keySet());
	}

	/**
	 * Closes every {@link ClosableDriver} and unregisters all drivers.
	 * A driver that fails to close is logged and doesn't prevent the others from closing.
	 */
	public void close() {
		for (DriverEntry entry : entries) {
			OdbDriver driver = drivers.remove(entry.name());
			if (driver instanceof ClosableDriver closable) {
				try {
					closable.close();
					LOGGER.debug("Closed driver \"{}\"", entry.name());
				} catch (Exception e) {
					LOGGER.warn("Error closing driver \"{}\"", entry.name(), e);
				}
			}
		}
		drivers.clear();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DriverRegistry.class);
}
