package works.odb.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;
import works.odb.DocumentId;

import static works.odb.logging.MdcKeys.COLLECTION;
import static works.odb.logging.MdcKeys.CONTEXT_INSTANCE_ID;
import static works.odb.logging.MdcKeys.CONTEXT_NAME;
import static works.odb.logging.MdcKeys.DOCUMENT_ID;
import static works.odb.logging.MdcKeys.DRIVER;

/**
 * Sets {@link MDC} entries for the duration of a try-with-resources block,
 * restoring the previous values on {@link MDCScope#close() close}.
 */
public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	public static MDCScope setupMDC(String contextName, String contextInstanceID) {
		MDCScope result = new MDCScope();
		result.put(CONTEXT_NAME, contextName);
		result.put(CONTEXT_INSTANCE_ID, contextInstanceID);
		return result;
	}

	public static MDCScope setupMDC(String contextName, String contextInstanceID, String driverName, String collection) {
		MDCScope result = setupMDC(contextName, contextInstanceID);
		result.put(DRIVER, driverName);
		result.put(COLLECTION, collection);
		return result;
	}

	public static MDCScope setupMDC(String contextName, String contextInstanceID, String driverName, String collection, DocumentId id) {
		MDCScope result = setupMDC(contextName, contextInstanceID, driverName, collection);
		result.put(DOCUMENT_ID, id == null ? null : id.toString());
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final Map<String, String> oldValues = new LinkedHashMap<>();

		MDCScope() { }

		void put(String key, String value) {
			if (!oldValues.containsKey(key)) {
				oldValues.put(key, MDC.get(key));
			}
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}

		@Override
		public void close() {
			oldValues.forEach((key, oldValue) -> {
				if (oldValue == null) {
					MDC.remove(key);
				} else {
					MDC.put(key, oldValue);
				}
			});
		}
	}
}
