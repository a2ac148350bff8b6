/**
 * The driver contract, its optional capabilities, and the in-memory driver.
 * Other drivers live in their own modules.
 */
package works.odb.drivers;
