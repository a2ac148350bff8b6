/**
 * A driver that keeps documents in MongoDB.
 */
package works.odb.drivers.mongo;
