/**
 * A driver that keeps one JSON file per document.
 */
package works.odb.drivers.fs;
