/**
 * The live-object model: mutable containers that report every change,
 * including changes to nested containers, to their subscribers.
 */
package works.odb.state;
