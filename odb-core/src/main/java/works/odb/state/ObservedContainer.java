package works.odb.state;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the mutable, observable containers that make up a live object.
 * <p>
 * Every change is reported to the container's subscribers and,
 * with the path prefixed accordingly, to the subscribers of every container that holds it.
 * <p>
 * Containers synchronize on themselves while reading or changing their contents,
 * but never hold that lock while calling listeners or other containers.
 */
public abstract sealed class ObservedContainer permits ObservedObject, ObservedArray {
	private final List<ListenerSubscription> subscriptions = new CopyOnWriteArrayList<>();

	/**
	 * Guarded by {@code this}.
	 */
	private final Map<ObservedContainer, Subscription> childSubscriptions = new IdentityHashMap<>();

	public Subscription subscribe(MutationListener listener) {
		ListenerSubscription result = new ListenerSubscription(listener);
		subscriptions.add(result);
		return result;
	}

	/**
	 * @return a shallow copy of the contents: nested containers are not copied.
	 */
	public abstract Object snapshot();

	/**
	 * @return a deep copy of the contents using plain {@link Map}s and {@link List}s.
	 */
	public abstract Object toPlainValue();

	/**
	 * @return every key or index at which {@code child} currently appears in this container.
	 */
	abstract List<Object> segmentsOf(ObservedContainer child);

	/**
	 * @return a copy of the values directly held by this container
	 */
	abstract Collection<Object> values();

	final void emit(Mutation mutation) {
		for (ListenerSubscription s : subscriptions) {
			s.deliver(mutation);
		}
	}

	/**
	 * Converts {@code value} into something a container may hold.
	 * If the result is itself a container, the caller must {@link #adopt} it
	 * once it has been stored.
	 */
	static Object normalize(Object value) {
		if (value == null
			|| value instanceof String
			|| value instanceof Boolean
			|| value instanceof ObservedContainer) {
			return value;
		} else if (value instanceof Integer || value instanceof Long || value instanceof Double
			|| value instanceof BigDecimal || value instanceof BigInteger) {
			return value;
		} else if (value instanceof Short || value instanceof Byte) {
			return ((Number) value).intValue();
		} else if (value instanceof Float f) {
			return f.doubleValue();
		} else if (value instanceof Map<?, ?> map) {
			return ObservedObject.of(map);
		} else if (value instanceof List<?> list) {
			return ObservedArray.of(list);
		} else {
			throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
		}
	}

	/**
	 * @throws IllegalArgumentException if storing {@code value} here would make this container contain itself
	 */
	final void checkNotAncestor(Object value) {
		if (value instanceof ObservedContainer c && (c == this || c.holds(this))) {
			throw new IllegalArgumentException("A container can't contain itself");
		}
	}

	private boolean holds(ObservedContainer target) {
		for (Object value : values()) {
			if (value == target || (value instanceof ObservedContainer c && c.holds(target))) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Starts relaying events from {@code value} if it's a container that isn't already relayed.
	 * Must be called while holding this container's lock.
	 */
	final void adopt(Object value) {
		if (value instanceof ObservedContainer child && !childSubscriptions.containsKey(child)) {
			childSubscriptions.put(child, child.subscribe(m -> relay(child, m)));
		}
	}

	/**
	 * Stops relaying events from {@code value} if it no longer appears in this container.
	 * Must be called while holding this container's lock, after the removal.
	 */
	final void orphan(Object value) {
		if (value instanceof ObservedContainer child && segmentsOf(child).isEmpty()) {
			Subscription s = childSubscriptions.remove(child);
			if (s != null) {
				s.cancel();
			}
		}
	}

	private void relay(ObservedContainer child, Mutation mutation) {
		List<Object> segments;
		synchronized (this) {
			segments = segmentsOf(child);
		}
		for (Object segment : segments) {
			emit(mutation.prefixed(segment));
		}
	}

	private static final class ListenerSubscription implements Subscription {
		final MutationListener listener;
		final AtomicBoolean isCancelled = new AtomicBoolean(false);

		ListenerSubscription(MutationListener listener) {
			this.listener = listener;
		}

		void deliver(Mutation mutation) {
			if (isCancelled.get()) {
				return;
			}
			try {
				listener.onMutation(mutation);
			} catch (RuntimeException e) {
				LOGGER.warn("Mutation listener threw an exception; ignoring", e);
			}
		}

		@Override
		public void cancel() {
			isCancelled.set(true);
		}

		@Override
		public boolean isCancelled() {
			return isCancelled.get();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObservedContainer.class);
}
