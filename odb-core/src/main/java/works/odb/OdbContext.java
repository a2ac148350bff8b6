package works.odb;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import works.odb.codec.StateCodec;
import works.odb.codec.TaggedStateCodec;

import static java.util.Objects.requireNonNull;

/**
 * Everything one {@link Odb} needs: the drivers it can use,
 * the schemas it enforces, and the watchers it has started.
 * <p>
 * Contexts share nothing, so any number of them can coexist in one process.
 */
public final class OdbContext {
	private final String name;
	private final String instanceID;
	private final DriverRegistry registry;
	private final Validator validator;
	private final WatcherManager watchers;
	private final StateCodec codec;

	private OdbContext(String name, List<DriverEntry> drivers, StateCodec codec) {
		this.name = name;
		this.instanceID = name + "-" + INSTANCE_COUNTER.incrementAndGet();
		this.registry = new DriverRegistry(drivers);
		this.validator = new Validator();
		this.watchers = new WatcherManager(instanceID);
		this.codec = codec;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a name for diagnostic purposes; not necessarily unique
	 */
	public String name() {
		return name;
	}

	/**
	 * @return a string that distinguishes this context from all others in the same process
	 */
	public String instanceID() {
		return instanceID;
	}

	public DriverRegistry registry() {
		return registry;
	}

	public Validator validator() {
		return validator;
	}

	public WatcherManager watchers() {
		return watchers;
	}

	public StateCodec codec() {
		return codec;
	}

	@Override
	public String toString() {
		return "OdbContext{" + instanceID + '}';
	}

	public static class Builder {
		private String name = "odb";
		private final List<DriverEntry> drivers = new ArrayList<>();
		private StateCodec codec = new TaggedStateCodec();

		Builder() { }

		public Builder name(String name) {
			this.name = requireNonNull(name);
			return this;
		}

		public Builder driver(DriverEntry entry) {
			this.drivers.add(requireNonNull(entry));
			return this;
		}

		public Builder drivers(Collection<DriverEntry> entries) {
			entries.forEach(this::driver);
			return this;
		}

		public Builder codec(StateCodec codec) {
			this.codec = requireNonNull(codec);
			return this;
		}

		public OdbContext build() {
			return new OdbContext(name, drivers, codec);
		}

		@Override
		public String toString() {
			return "OdbContext.Builder(name=" + name + ", drivers=" + drivers + ", codec=" + codec + ")";
		}
	}

	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(1000);
}
