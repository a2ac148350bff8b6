package works.odb.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static works.odb.state.Mutation.Kind.DELETE;
import static works.odb.state.Mutation.Kind.INSERT;
import static works.odb.state.Mutation.Kind.SET;
import static works.odb.state.ObservedObject.isUnchanged;
import static works.odb.state.ObservedObject.plain;

/**
 * A live list container.
 */
public final class ObservedArray extends ObservedContainer {
	/**
	 * Guarded by {@code this}.
	 */
	private final List<Object> contents = new ArrayList<>();

	/**
	 * @return a new array holding the elements of {@code list}, with nested
	 * {@link Map}s and {@link List}s converted to containers.
	 */
	public static ObservedArray of(List<?> list) {
		ObservedArray result = new ObservedArray();
		list.forEach(result::add);
		return result;
	}

	public synchronized Object get(int index) {
		return contents.get(index);
	}

	/**
	 * Appends {@code value}.
	 *
	 * @throws IllegalArgumentException if {@code value} is this array or contains it
	 */
	public void add(Object value) {
		Object newValue = normalize(value);
		checkNotAncestor(newValue);
		int index;
		synchronized (this) {
			index = contents.size();
			contents.add(newValue);
			adopt(newValue);
		}
		emit(new Mutation(List.of(index), INSERT, null, newValue));
	}

	public void add(int index, Object value) {
		Object newValue = normalize(value);
		checkNotAncestor(newValue);
		synchronized (this) {
			contents.add(index, newValue);
			adopt(newValue);
		}
		emit(new Mutation(List.of(index), INSERT, null, newValue));
	}

	/**
	 * @return the previous element at {@code index}
	 */
	public Object set(int index, Object value) {
		Object newValue = normalize(value);
		checkNotAncestor(newValue);
		Object oldValue;
		synchronized (this) {
			oldValue = contents.set(index, newValue);
			if (isUnchanged(oldValue, newValue)) {
				return oldValue;
			}
			adopt(newValue);
			orphan(oldValue);
		}
		emit(new Mutation(List.of(index), SET, oldValue, newValue));
		return oldValue;
	}

	/**
	 * @return the removed element
	 */
	public Object remove(int index) {
		Object oldValue;
		synchronized (this) {
			oldValue = contents.remove(index);
			orphan(oldValue);
		}
		emit(new Mutation(List.of(index), DELETE, oldValue, null));
		return oldValue;
	}

	public synchronized int size() {
		return contents.size();
	}

	@Override
	public synchronized List<Object> snapshot() {
		return new ArrayList<>(contents);
	}

	@Override
	public List<Object> toPlainValue() {
		List<Object> result = new ArrayList<>();
		snapshot().forEach(v -> result.add(plain(v)));
		return result;
	}

	@Override
	Collection<Object> values() {
		return snapshot();
	}

	@Override
	synchronized List<Object> segmentsOf(ObservedContainer child) {
		List<Object> result = new ArrayList<>(1);
		for (int i = 0; i < contents.size(); i++) {
			if (contents.get(i) == child) {
				result.add(i);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return "ObservedArray" + toPlainValue();
	}
}
