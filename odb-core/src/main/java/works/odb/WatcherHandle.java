package works.odb;

import java.util.concurrent.atomic.AtomicLong;
import works.odb.state.MutationListener;
import works.odb.state.ObservedObject;
import works.odb.state.Subscription;

/**
 * Binds one live object to the document it persists to.
 * <p>
 * Counts what became of each observed mutation:
 * <ul>
 *     <li>persisted: written to the driver</li>
 *     <li>skipped: not written because the object failed validation</li>
 *     <li>failed: the driver threw an exception or no longer had the document</li>
 * </ul>
 */
public final class WatcherHandle {
	private final String driverName;
	private final String collection;
	private final DocumentId id;
	private final ObservedObject value;
	private volatile Subscription subscription;

	private final AtomicLong persistedCount = new AtomicLong();
	private final AtomicLong skippedCount = new AtomicLong();
	private final AtomicLong failedCount = new AtomicLong();

	public WatcherHandle(String driverName, String collection, DocumentId id, ObservedObject value) {
		this.driverName = driverName;
		this.collection = collection;
		this.id = id;
		this.value = value;
	}

	/**
	 * Subscribes {@code listener} to the live object. Can only be called once.
	 */
	synchronized void start(MutationListener listener) {
		if (subscription != null) {
			throw new IllegalStateException("Watcher already started for " + this);
		}
		subscription = value.subscribe(listener);
	}

	/**
	 * Stops observing the live object. Writes already scheduled may still complete.
	 * Idempotent.
	 */
	public void cancel() {
		Subscription s = subscription;
		if (s != null) {
			s.cancel();
		}
	}

	public boolean isCancelled() {
		Subscription s = subscription;
		return s != null && s.isCancelled();
	}

	public String driverName() {
		return driverName;
	}

	public String collection() {
		return collection;
	}

	public DocumentId id() {
		return id;
	}

	public ObservedObject value() {
		return value;
	}

	public long persistedCount() {
		return persistedCount.get();
	}

	public long skippedCount() {
		return skippedCount.get();
	}

	public long failedCount() {
		return failedCount.get();
	}

	void recordPersisted() {
		persistedCount.incrementAndGet();
	}

	void recordSkipped() {
		skippedCount.incrementAndGet();
	}

	void recordFailed() {
		failedCount.incrementAndGet();
	}

	@Override
	public String toString() {
		return "WatcherHandle{" + driverName + ":" + collection + "/" + id + '}';
	}
}
