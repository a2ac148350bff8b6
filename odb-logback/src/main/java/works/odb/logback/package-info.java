/**
 * Logback-specific logging utilities.
 */
package works.odb.logback;
