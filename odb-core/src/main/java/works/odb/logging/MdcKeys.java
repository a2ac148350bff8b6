package works.odb.logging;

/**
 * Keys of the SLF4J {@link org.slf4j.MDC MDC} entries set by ODB.
 */
public final class MdcKeys {
	private MdcKeys() { }

	public static final String CONTEXT_NAME = "odb.name";
	public static final String CONTEXT_INSTANCE_ID = "odb.instanceID";
	public static final String DRIVER = "odb.driver";
	public static final String COLLECTION = "odb.collection";
	public static final String DOCUMENT_ID = "odb.document";
}
