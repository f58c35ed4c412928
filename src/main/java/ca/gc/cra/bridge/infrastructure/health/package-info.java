/**
 * HTTP health endpoint on the JDK's built-in server.
 */
package ca.gc.cra.bridge.infrastructure.health;
