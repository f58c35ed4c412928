/**
 * Thread factories and the connection retry policy shared by broker adapters.
 */
package ca.gc.cra.bridge.infrastructure.exec;
