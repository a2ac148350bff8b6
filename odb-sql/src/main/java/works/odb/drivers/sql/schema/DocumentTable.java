package works.odb.drivers.sql.schema;

import java.sql.Connection;
import java.sql.SQLException;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.DSL.using;
import static org.jooq.impl.SQLDataType.CLOB;
import static org.jooq.impl.SQLDataType.VARCHAR;

/**
 * jOOQ references for the single table in which the SQL driver stores documents.
 */
public class DocumentTable {
	public final Table<Record> TABLE;
	public final Field<String> ID = field(name("id"), VARCHAR(36).nullable(false));
	public final Field<String> COLLECTION = field(name("collection"), VARCHAR(255).nullable(false));
	public final Field<String> STATE_TREE = field(name("state_tree"), CLOB.nullable(false));
	public final Field<String> STATE_JSON = field(name("state_json"), CLOB.nullable(false));

	private final String tableName;

	public DocumentTable(String tableName) {
		this.tableName = tableName;
		this.TABLE = table(name(tableName));
	}

	public void createTable(Connection connection) throws SQLException {
		using(connection)
			.createTableIfNotExists(TABLE)
			.columns(ID, COLLECTION, STATE_TREE, STATE_JSON)
			.constraints(primaryKey(ID))
			.execute();

		using(connection)
			.createIndexIfNotExists(name(tableName + "_collection"))
			.on(TABLE, COLLECTION)
			.execute();

		connection.commit();
	}

	public void dropTable(Connection connection) throws SQLException {
		using(connection)
			.dropTableIfExists(TABLE)
			.execute();

		connection.commit();
	}
}
