/**
 * Exceptions that can reach users of {@link works.odb.Odb}.
 * <p>
 * {@link works.odb.exceptions.ValidationException} is checked and is recovered
 * from inside {@link works.odb.Odb}; the rest are unchecked.
 */
package works.odb.exceptions;
