package works.odb.drivers;

import works.odb.Query;

/**
 * A driver whose queries name fields differently from the caller's view of the state.
 */
public interface QueryTransformingDriver extends OdbDriver {
	/**
	 * @return the query to pass to {@link #query}, equivalent to the caller's {@code query}
	 */
	Query transformQuery(Query query);
}
