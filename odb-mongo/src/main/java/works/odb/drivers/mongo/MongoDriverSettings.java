package works.odb.drivers.mongo;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.odb.OdbProperties;

@Value
@Builder(toBuilder = true)
public class MongoDriverSettings {
	public static final String URI = "mongodb.uri";
	public static final String DATABASE = "mongodb.database";
	public static final String SERVER_SELECTION_TIMEOUT_MS = "mongodb.serverSelectionTimeoutMS";

	@Default String database = "odb";

	/**
	 * How long to wait for the server when the driver is initialized
	 * and on each operation thereafter.
	 * <p>
	 * If the server can't be reached within this time during initialization,
	 * the driver reports failure rather than waiting indefinitely.
	 */
	@Default int serverSelectionTimeoutMS = 10_000;

	/**
	 * Reads {@value #DATABASE} and {@value #SERVER_SELECTION_TIMEOUT_MS} from the settings.
	 */
	public static MongoDriverSettings from(OdbProperties props) {
		MongoDriverSettingsBuilder builder = MongoDriverSettings.builder();
		props.setting(DATABASE).ifPresent(builder::database);
		props.setting(SERVER_SELECTION_TIMEOUT_MS).map(Integer::parseInt).ifPresent(builder::serverSelectionTimeoutMS);
		return builder.build();
	}

	void validate() {
		if (database == null || database.isEmpty()) {
			throw new IllegalArgumentException("Database name is required");
		}
		if (serverSelectionTimeoutMS <= 0) {
			throw new IllegalArgumentException("Timeout must be positive: " + serverSelectionTimeoutMS);
		}
	}
}
