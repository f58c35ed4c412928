/**
 * Replication directions and the route table that maps source identifiers to destinations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bridge.domain.route;
