package works.odb.drivers.sql;

import java.util.regex.Pattern;
import works.odb.OdbProperties;

import static java.util.Objects.requireNonNull;

/**
 * @param tableName the table holding every collection's documents
 * @param dropTableOnClose deletes the table and everything in it when the driver closes
 */
public record SqlDriverSettings(
	String tableName,
	boolean dropTableOnClose
) {
	public static final String URL = "sql.url";
	public static final String TABLE = "sql.table";
	public static final String DEFAULT_TABLE = "odb_document";

	private static final Pattern VALID_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public SqlDriverSettings {
		requireNonNull(tableName);
		if (!VALID_TABLE_NAME.matcher(tableName).matches()) {
			throw new IllegalArgumentException("Invalid table name \"" + tableName + "\"");
		}
	}

	/**
	 * Reads {@value #TABLE}. In test mode, the table is dropped on close.
	 */
	public static SqlDriverSettings from(OdbProperties props) {
		return new SqlDriverSettings(
			props.setting(TABLE).orElse(DEFAULT_TABLE),
			props.test());
	}
}
