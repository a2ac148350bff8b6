package works.odb;

import static java.util.Objects.requireNonNull;

/**
 * @param message explains the rule to the user when a value breaks it
 */
public record FieldRule(
	FieldPredicate predicate,
	String message
) {
	public FieldRule {
		requireNonNull(predicate);
		requireNonNull(message);
	}
}
