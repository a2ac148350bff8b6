package works.odb.drivers.sql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Path;

final class SqlTestService {
	private SqlTestService() { }

	/**
	 * SQLite allows only one writer at a time, so the pool has a single connection.
	 */
	static HikariDataSource sqliteDataSource(Path databaseFile) {
		HikariConfig config = new HikariConfig();
		config.setJdbcUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
		config.setMaximumPoolSize(1);
		config.setPoolName("sqlite-" + databaseFile.getFileName());
		return new HikariDataSource(config);
	}
}
