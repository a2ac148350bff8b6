package works.odb.state;

import java.util.ArrayList;
import java.util.List;

/**
 * One change to a live object.
 *
 * @param path the keys ({@link String}) and indexes ({@link Integer}) leading from the
 *             container that reported the change to the changed slot
 * @param kind what happened to the slot
 * @param oldValue the previous value, or null if there wasn't one
 * @param newValue the new value, or null for {@link Kind#DELETE DELETE}
 */
public record Mutation(
	List<Object> path,
	Kind kind,
	Object oldValue,
	Object newValue
) {
	public Mutation {
		path = List.copyOf(path);
	}

	public enum Kind {
		/**
		 * An existing slot, or a new key of an {@link ObservedObject}, received a value.
		 */
		SET,

		/**
		 * A new element was inserted into an {@link ObservedArray}, shifting later elements.
		 */
		INSERT,

		/**
		 * A key or element was removed.
		 */
		DELETE,
	}

	/**
	 * @return the same mutation as seen from a container one level further out,
	 * in which the reporting container lives at {@code segment}.
	 */
	public Mutation prefixed(Object segment) {
		List<Object> newPath = new ArrayList<>(path.size() + 1);
		newPath.add(segment);
		newPath.addAll(path);
		return new Mutation(newPath, kind, oldValue, newValue);
	}
}
