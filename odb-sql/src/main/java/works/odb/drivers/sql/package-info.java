/**
 * A driver storing documents in any SQL database reachable through JDBC,
 * using jOOQ to generate the dialect-specific statements.
 */
package works.odb.drivers.sql;
