package works.odb;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the {@link WatcherHandle}s of one {@link OdbContext}
 * and runs their persistence tasks.
 * <p>
 * Tasks run on a thread pool that lives from {@link #start()} to {@link #closeAll()}.
 * Each task is independent: tasks for the same document may overlap,
 * in which case the last one to finish determines the stored state.
 */
public final class WatcherManager {
	private final String threadNamePrefix;
	private final Set<WatcherHandle> handles = ConcurrentHashMap.newKeySet();
	private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();
	private volatile ExecutorService executor;

	public WatcherManager(String threadNamePrefix) {
		this.threadNamePrefix = threadNamePrefix;
	}

	/**
	 * Starts accepting tasks. Does nothing if already started.
	 */
	public synchronized void start() {
		if (executor == null) {
			executor = Executors.newCachedThreadPool(threadFactory());
		}
	}

	public boolean isRunning() {
		return executor != null;
	}

	public void track(WatcherHandle handle) {
		handles.add(handle);
	}

	public List<WatcherHandle> handles() {
		return List.copyOf(handles);
	}

	public int size() {
		return handles.size();
	}

	/**
	 * Runs {@code task} asynchronously. If the manager isn't running, the task is dropped.
	 * Exceptions thrown by {@code task} are logged.
	 */
	public void submit(Runnable task) {
		ExecutorService ex = executor;
		if (ex == null) {
			LOGGER.warn("Watcher manager is not running; dropping task");
			return;
		}
		CompletableFuture<Void> done = new CompletableFuture<>();
		pending.add(done);
		try {
			ex.execute(() -> {
				try {
					task.run();
				} catch (RuntimeException e) {
					LOGGER.error("Unexpected exception from persistence task", e);
				} finally {
					pending.remove(done);
					done.complete(null);
				}
			});
		} catch (RejectedExecutionException e) {
			pending.remove(done);
			done.complete(null);
			LOGGER.warn("Watcher manager is shutting down; dropping task");
		}
	}

	/**
	 * Waits until every task submitted before this call has finished.
	 */
	public void flush() {
		CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
	}

	/**
	 * Cancels every tracked handle, forgets them, and stops accepting tasks.
	 * Tasks already running are not waited for.
	 */
	public synchronized void closeAll() {
		for (WatcherHandle handle : handles) {
			try {
				handle.cancel();
			} catch (RuntimeException e) {
				LOGGER.warn("Error cancelling {}", handle, e);
			}
		}
		handles.clear();
		ExecutorService ex = executor;
		executor = null;
		if (ex != null) {
			ex.shutdown();
		}
	}

	private ThreadFactory threadFactory() {
		AtomicInteger counter = new AtomicInteger();
		return r -> {
			Thread thread = new Thread(r, threadNamePrefix + "-watcher-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WatcherManager.class);
}
