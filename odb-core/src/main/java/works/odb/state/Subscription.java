package works.odb.state;

/**
 * A registration of a {@link MutationListener} on a live object.
 * <p>
 * Once cancelled, a subscription delivers no further events and cannot be restarted;
 * subscribe again to receive events.
 */
public interface Subscription {
	/**
	 * Stops event delivery. Idempotent.
	 */
	void cancel();

	boolean isCancelled();
}
