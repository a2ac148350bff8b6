package works.odb.drivers.mongo;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.odb.DriverRegistry;
import works.odb.Environment;
import works.odb.Odb;
import works.odb.OdbContext;
import works.odb.OdbProperties;
import works.odb.Query;
import works.odb.exceptions.UnknownDriverException;
import works.odb.logback.OdbLogFilter;
import works.odb.logback.OdbLogFilter.LogController;

import static ch.qos.logback.classic.Level.ERROR;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Needs no server: every case here fails before reaching one.
 */
class MongoDriverInitializationFailureTest {
	OdbContext context;
	Odb odb;

	@BeforeEach
	void setup() {
		context = OdbContext.builder()
			.name(MongoDriverInitializationFailureTest.class.getSimpleName())
			.driver(MongoDriver.entry())
			.build();
		// We're expecting a warning about the failed driver
		LogController logController = new LogController();
		logController.setLogging(ERROR, DriverRegistry.class);
		OdbLogFilter.register(context, logController);
		odb = new Odb(context);
	}

	@AfterEach
	void tearDown() {
		odb.close();
		OdbLogFilter.unregister(context);
	}

	@Test
	void unreachable() throws IOException {
		int port;
		try (var socket = new ServerSocket(0)) {
			port = socket.getLocalPort();
		}
		Map<String, Boolean> status = odb.init(OdbProperties.builder()
			.setting(MongoDriverSettings.URI, "mongodb://localhost:" + port)
			.setting(MongoDriverSettings.SERVER_SELECTION_TIMEOUT_MS, "200")
			.build());
		assertEquals(Map.of(MongoDriver.NAME, false), status);
		assertThrows(UnknownDriverException.class, () -> odb.remove(MongoDriver.NAME, "anything", Query.empty()));
	}

	@Test
	void missingUri() {
		assertEquals(Map.of(MongoDriver.NAME, false), odb.init(OdbProperties.builder().build()));
	}

	@Test
	void notEligibleOnClient() {
		assertEquals(Map.of(), odb.init(OdbProperties.builder()
			.environment(Environment.CLIENT)
			.build()));
	}
}
