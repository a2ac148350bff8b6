package works.odb;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.odb.drivers.ForwardingDriver;
import works.odb.drivers.MemoryDriver;
import works.odb.drivers.OdbDriver;
import works.odb.exceptions.UnknownDriverException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.odb.Environment.CLIENT;
import static works.odb.Environment.SERVER;

class DriverRegistryTest {
	final AtomicInteger serverBuilds = new AtomicInteger();
	final AtomicInteger closes = new AtomicInteger();
	DriverRegistry registry;

	@BeforeEach
	void setup() {
		registry = new DriverRegistry(List.of(
			new DriverEntry("server", SERVER, props -> {
				serverBuilds.incrementAndGet();
				return new ForwardingDriver(new MemoryDriver()) {
					@Override
					public void close() {
						closes.incrementAndGet();
						throw new IllegalStateException("Close failure");
					}
				};
			}),
			new DriverEntry("broken", SERVER, props -> { throw new IllegalStateException("Unreachable"); }),
			MemoryDriver.entry()
		));
	}

	@Test
	void serverEnvironment() {
		Map<String, Boolean> expected = new LinkedHashMap<>();
		expected.put("server", true);
		expected.put("broken", false);
		assertEquals(expected, registry.init(OdbProperties.builder().environment(SERVER).build()));
		assertInstanceOf(OdbDriver.class, registry.driver("server"));
		assertThrows(UnknownDriverException.class, () -> registry.driver("broken"));
		assertThrows(UnknownDriverException.class, () -> registry.driver(MemoryDriver.NAME));
	}

	@Test
	void clientEnvironment() {
		assertEquals(Map.of(MemoryDriver.NAME, true),
			registry.init(OdbProperties.builder().environment(CLIENT).build()));
		assertEquals(0, serverBuilds.get());
	}

	@Test
	void testMode_initializesEverything() {
		Map<String, Boolean> status = registry.init(OdbProperties.builder().test(true).environment(CLIENT).build());
		assertEquals(List.of("server", "broken", MemoryDriver.NAME), List.copyOf(status.keySet()));
		assertEquals(List.of(true, false, true), List.copyOf(status.values()));
	}

	@Test
	void requestedDrivers_restrictInit() {
		assertEquals(Map.of(MemoryDriver.NAME, true),
			registry.init(OdbProperties.builder().test(true).driver(MemoryDriver.NAME).build()));
		assertFalse(registry.isRegistered("server"));
	}

	@Test
	void secondInit_keepsExistingDriver() {
		OdbProperties props = OdbProperties.builder().environment(SERVER).build();
		registry.init(props);
		OdbDriver first = registry.driver("server");
		assertEquals(true, registry.init(props).get("server"));
		assertSame(first, registry.driver("server"));
		assertEquals(1, serverBuilds.get());
	}

	@Test
	void close_toleratesFailuresAndUnregisters() {
		registry.init(OdbProperties.builder().test(true).build());
		registry.close();
		assertEquals(1, closes.get());
		assertTrue(registry.registeredNames().isEmpty());
		assertThrows(UnknownDriverException.class, () -> registry.driver(MemoryDriver.NAME));
	}

	@Test
	void nullName_isUnknown() {
		registry.init(OdbProperties.builder().test(true).build());
		assertThrows(UnknownDriverException.class, () -> registry.driver(null));
		assertFalse(registry.isRegistered(null));
	}

	@Test
	void duplicateNames_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new DriverRegistry(List.of(MemoryDriver.entry(), MemoryDriver.entry())));
	}
}
