/**
 * Binds live objects to documents in pluggable storage backends.
 * <p>
 * Start with {@link works.odb.OdbContext#builder()} and {@link works.odb.Odb}.
 */
package works.odb;
