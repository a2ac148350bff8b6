package works.odb;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Singular;
import lombok.Value;

/**
 * Properties handed to every {@link DriverFactory} when a {@link DriverRegistry} is initialized.
 */
@Value
@Builder(toBuilder = true)
public class OdbProperties {
	/**
	 * In test mode, environment gating is bypassed and drivers that support it
	 * use throwaway storage.
	 */
	@Default boolean test = false;

	/**
	 * The environment this process runs in.
	 * Outside test mode, only drivers declared for this environment are initialized.
	 */
	@Default Environment environment = Environment.SERVER;

	/**
	 * The names of the drivers to initialize. If empty, every eligible driver is initialized.
	 */
	@Singular Set<String> drivers;

	/**
	 * Driver-specific settings, conventionally keyed by {@code <driverName>.<setting>}.
	 */
	@Singular Map<String, String> settings;

	public Optional<String> setting(String key) {
		return Optional.ofNullable(settings.get(key));
	}

	/**
	 * Reads properties from environment variables:
	 * <ul>
	 *     <li>{@code ODB_TEST}: {@code true} enables test mode</li>
	 *     <li>{@code ODB_ENVIRONMENT}: {@code server} or {@code client}</li>
	 *     <li>{@code ODB_DRIVERS}: comma-separated driver names</li>
	 *     <li>{@code DB}: MongoDB connection string</li>
	 *     <li>{@code DB_TABLE}: MongoDB database name</li>
	 *     <li>{@code ODB_FS_DIR}: root directory of the filesystem driver</li>
	 *     <li>{@code ODB_SQL_URL}: JDBC URL of the SQL driver</li>
	 * </ul>
	 */
	public static OdbProperties fromEnvironment(Map<String, String> env) {
		OdbPropertiesBuilder builder = OdbProperties.builder()
			.test(Boolean.parseBoolean(env.getOrDefault("ODB_TEST", "false")));
		String environment = env.get("ODB_ENVIRONMENT");
		if (environment != null && !environment.isBlank()) {
			builder.environment(Environment.valueOf(environment.trim().toUpperCase()));
		}
		String drivers = env.get("ODB_DRIVERS");
		if (drivers != null) {
			Arrays.stream(drivers.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.forEach(builder::driver);
		}
		copySetting(env, "DB", builder, "mongodb.uri");
		copySetting(env, "DB_TABLE", builder, "mongodb.database");
		copySetting(env, "ODB_FS_DIR", builder, "fs.baseDir");
		copySetting(env, "ODB_SQL_URL", builder, "sql.url");
		return builder.build();
	}

	private static void copySetting(Map<String, String> env, String variable, OdbPropertiesBuilder builder, String key) {
		String value = env.get(variable);
		if (value != null && !value.isBlank()) {
			builder.setting(key, value);
		}
	}
}
