package works.odb.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static works.odb.state.Mutation.Kind.DELETE;
import static works.odb.state.Mutation.Kind.SET;

/**
 * A live, string-keyed container. Keys keep their insertion order.
 */
public final class ObservedObject extends ObservedContainer {
	/**
	 * Guarded by {@code this}.
	 */
	private final Map<String, Object> contents = new LinkedHashMap<>();

	/**
	 * @return a new object holding the entries of {@code map}, with nested
	 * {@link Map}s and {@link List}s converted to containers.
	 * @throws IllegalArgumentException if a key isn't a {@link String} or a value has an unsupported type
	 */
	public static ObservedObject of(Map<?, ?> map) {
		ObservedObject result = new ObservedObject();
		map.forEach((k, v) -> {
			if (k instanceof String key) {
				result.put(key, v);
			} else {
				throw new IllegalArgumentException("Object keys must be strings: " + k);
			}
		});
		return result;
	}

	public synchronized Object get(String key) {
		return contents.get(key);
	}

	public synchronized boolean containsKey(String key) {
		return contents.containsKey(key);
	}

	/**
	 * @return the previous value, or null if there wasn't one
	 * @throws IllegalArgumentException if {@code value} is this object or contains it
	 */
	public Object put(String key, Object value) {
		requireNonNull(key);
		Object newValue = normalize(value);
		checkNotAncestor(newValue);
		Object oldValue;
		synchronized (this) {
			boolean existed = contents.containsKey(key);
			oldValue = contents.put(key, newValue);
			if (existed && isUnchanged(oldValue, newValue)) {
				return oldValue;
			}
			adopt(newValue);
			orphan(oldValue);
		}
		emit(new Mutation(List.of(key), SET, oldValue, newValue));
		return oldValue;
	}

	/**
	 * @return the removed value, or null if there wasn't one
	 */
	public Object remove(String key) {
		Object oldValue;
		synchronized (this) {
			if (!contents.containsKey(key)) {
				return null;
			}
			oldValue = contents.remove(key);
			orphan(oldValue);
		}
		emit(new Mutation(List.of(key), DELETE, oldValue, null));
		return oldValue;
	}

	public synchronized Set<String> keySet() {
		return new LinkedHashSet<>(contents.keySet());
	}

	public synchronized int size() {
		return contents.size();
	}

	@Override
	public synchronized Map<String, Object> snapshot() {
		return new LinkedHashMap<>(contents);
	}

	/**
	 * @return a new object with the same contents, sharing no containers with this one
	 * and with no subscribers
	 */
	public ObservedObject detachedCopy() {
		return of(toPlainValue());
	}

	@Override
	public Map<String, Object> toPlainValue() {
		Map<String, Object> result = new LinkedHashMap<>();
		snapshot().forEach((k, v) -> result.put(k, plain(v)));
		return result;
	}

	@Override
	synchronized Collection<Object> values() {
		return new ArrayList<>(contents.values());
	}

	@Override
	synchronized List<Object> segmentsOf(ObservedContainer child) {
		List<Object> result = new ArrayList<>(1);
		contents.forEach((k, v) -> {
			if (v == child) {
				result.add(k);
			}
		});
		return result;
	}

	static boolean isUnchanged(Object oldValue, Object newValue) {
		if (oldValue == newValue) {
			return true;
		} else if (oldValue instanceof ObservedContainer || newValue instanceof ObservedContainer) {
			return false;
		} else {
			return Objects.equals(oldValue, newValue);
		}
	}

	static Object plain(Object value) {
		if (value instanceof ObservedContainer c) {
			return c.toPlainValue();
		} else {
			return value;
		}
	}

	@Override
	public String toString() {
		return "ObservedObject" + toPlainValue();
	}
}
