package works.odb.drivers;

import java.util.Optional;
import works.odb.Document;
import works.odb.DocumentId;
import works.odb.Query;
import works.odb.StateDocument;

/**
 * Implements all {@link OdbDriver} methods by simply calling the corresponding
 * methods on another driver. Useful for overriding one or two methods while leaving
 * the rest unchanged.
 * <p>
 * Optional capabilities behave as though the downstream driver were used directly:
 * queries are transformed only if it is a {@link QueryTransformingDriver},
 * and closed only if it is a {@link ClosableDriver}.
 */
public class ForwardingDriver implements QueryTransformingDriver, ClosableDriver {
	protected final OdbDriver downstream;

	public ForwardingDriver(OdbDriver downstream) {
		this.downstream = downstream;
	}

	@Override
	public Document create(String collection, StateDocument doc) {
		return downstream.create(collection, doc);
	}

	@Override
	public Optional<Document> query(String collection, Query nativeQuery) {
		return downstream.query(collection, nativeQuery);
	}

	@Override
	public boolean update(String collection, DocumentId id, StateDocument doc) {
		return downstream.update(collection, id, doc);
	}

	@Override
	public boolean remove(String collection, DocumentId id) {
		return downstream.remove(collection, id);
	}

	@Override
	public Query transformQuery(Query query) {
		if (downstream instanceof QueryTransformingDriver d) {
			return d.transformQuery(query);
		} else {
			return query;
		}
	}

	@Override
	public void close() throws Exception {
		if (downstream instanceof ClosableDriver d) {
			d.close();
		}
	}

	@Override
	public String toString() {
		return "ForwardingDriver{" +
			"downstream=" + downstream +
			'}';
	}
}
