package works.odb;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OdbPropertiesTest {

	@Test
	void emptyEnvironment_defaults() {
		OdbProperties props = OdbProperties.fromEnvironment(Map.of());
		assertFalse(props.test());
		assertEquals(Environment.SERVER, props.environment());
		assertTrue(props.drivers().isEmpty());
		assertTrue(props.settings().isEmpty());
	}

	@Test
	void allVariables_areRead() {
		OdbProperties props = OdbProperties.fromEnvironment(Map.of(
			"ODB_TEST", "true",
			"ODB_ENVIRONMENT", " client ",
			"ODB_DRIVERS", "memory, fs,,mongodb",
			"DB", "mongodb://localhost:27017",
			"DB_TABLE", "app",
			"ODB_FS_DIR", "/var/odb",
			"ODB_SQL_URL", "jdbc:sqlite:odb.db"));
		assertTrue(props.test());
		assertEquals(Environment.CLIENT, props.environment());
		assertEquals(Set.of("memory", "fs", "mongodb"), props.drivers());
		assertEquals(Optional.of("mongodb://localhost:27017"), props.setting("mongodb.uri"));
		assertEquals(Optional.of("app"), props.setting("mongodb.database"));
		assertEquals(Optional.of("/var/odb"), props.setting("fs.baseDir"));
		assertEquals(Optional.of("jdbc:sqlite:odb.db"), props.setting("sql.url"));
	}

	@Test
	void blankSetting_isIgnored() {
		OdbProperties props = OdbProperties.fromEnvironment(Map.of("DB", "  "));
		assertEquals(Optional.empty(), props.setting("mongodb.uri"));
	}

	@Test
	void unknownEnvironment_throws() {
		assertThrows(IllegalArgumentException.class, () -> OdbProperties.fromEnvironment(Map.of("ODB_ENVIRONMENT", "browser")));
	}
}
