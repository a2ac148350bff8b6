package works.odb;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Decides whether a field value is acceptable. May complete asynchronously.
 * <p>
 * The value is whatever the live object holds for the field:
 * null, a string, number or boolean, or a nested container.
 */
@FunctionalInterface
public interface FieldPredicate {
	CompletionStage<Boolean> test(Object value);

	static FieldPredicate of(Predicate<Object> predicate) {
		return value -> CompletableFuture.completedFuture(predicate.test(value));
	}
}
