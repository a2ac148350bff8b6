package works.odb.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.odb.OdbContext;
import works.odb.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.odb.logging.MdcKeys.CONTEXT_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-context logging control.
 * Intended to suppress expected warnings and errors during testing.
 * <p>
 * An {@link OdbContext} {@link #register registered} with a {@link LogController}
 * can have its log levels changed using {@link LogController#setLogging}
 * without affecting other contexts.
 * <p>
 * This class infers that a log message is associated with a particular context
 * by checking the MDC for the key {@link MdcKeys#CONTEXT_INSTANCE_ID},
 * which {@link works.odb.Odb Odb} sets around every operation and persistence task.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message comes from a registered context
 *         whose controller has an override for that specific logger,
 *         messages below the override level are dropped;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply.
 *     </li>
 * </ol>
 */
public class OdbLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByInstanceID = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// SLF4J's Level has no OFF, so this uses Logback's
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}

		public void reset() {
			overrides.clear();
		}
	}

	/**
	 * Causes {@code controller} to control logs emitted on behalf of {@code context}.
	 *
	 * @throws IllegalStateException if the context already has a controller
	 */
	public static void register(OdbContext context, LogController controller) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Registering controller {} for context {} \"{}\"", System.identityHashCode(controller), context.instanceID(), context.name());
		}
		LogController old = controllersByInstanceID.putIfAbsent(context.instanceID(), controller);
		if (old != null && old != controller) {
			throw new IllegalStateException("Context already has a log controller: " + context);
		}
	}

	public static void unregister(OdbContext context) {
		controllersByInstanceID.remove(context.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Respect user-supplied log levels
			return NEUTRAL;
		}
		String instanceID = MDC.get(CONTEXT_INSTANCE_ID);
		if (instanceID == null) {
			return NEUTRAL;
		}
		LogController controller = controllersByInstanceID.get(instanceID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}

		if (messageLevel.isGreaterOrEqual(overrideLevel)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(OdbLogFilter.class);
}
