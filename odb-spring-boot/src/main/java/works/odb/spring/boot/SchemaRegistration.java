package works.odb.spring.boot;

import works.odb.Schema;

import static java.util.Objects.requireNonNull;

/**
 * Declare beans of this type to have {@link OdbAutoConfiguration}
 * register their schemas before any document is opened.
 */
public record SchemaRegistration(String collection, Schema schema) {
	public SchemaRegistration {
		requireNonNull(collection);
		requireNonNull(schema);
	}
}
