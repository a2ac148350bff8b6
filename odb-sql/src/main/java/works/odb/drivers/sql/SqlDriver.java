package works.odb.drivers.sql;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import works.odb.DriverEntry;
import works.odb.Environment;
import works.odb.drivers.ClosableDriver;
import works.odb.drivers.QueryTransformingDriver;

/**
 * Stores documents from every collection in one SQL table,
 * with the state tree and state JSON held as JSON text.
 * <p>
 * Queries are evaluated in Java against the stored state JSON,
 * so any database jOOQ supports will do.
 */
public interface SqlDriver extends QueryTransformingDriver, ClosableDriver {
	String NAME = "sql";

	/**
	 * Connects using {@link DriverManager} to the JDBC URL in {@value SqlDriverSettings#URL},
	 * which must be present in the settings.
	 */
	static DriverEntry entry() {
		return new DriverEntry(NAME, Environment.SERVER, props -> {
			String url = props.setting(SqlDriverSettings.URL)
				.orElseThrow(() -> new IllegalArgumentException("Missing setting " + SqlDriverSettings.URL));
			return new SqlDriverImpl(SqlDriverSettings.from(props), () -> DriverManager.getConnection(url));
		});
	}

	static DriverEntry entry(SqlDriverSettings settings, ConnectionSource connectionSource) {
		return new DriverEntry(NAME, Environment.SERVER, props -> new SqlDriverImpl(settings, connectionSource));
	}

	/**
	 * Best-effort cleanup. Drops the table if {@link SqlDriverSettings#dropTableOnClose()} is set.
	 */
	@Override
	void close();

	interface ConnectionSource {
		Connection get() throws SQLException;
	}
}
