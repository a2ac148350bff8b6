/**
 * Conversion of live objects to and from the JSON stored by drivers.
 */
package works.odb.codec;
