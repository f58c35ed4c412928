/**
 * Logging helpers: runtime level control, MDC binding and payload-safe formatting.
 * <p>Backed by SLF4J with Logback; see {@code logback.xml} for the console layout.</p>
 */
package ca.gc.cra.bridge.logging;
