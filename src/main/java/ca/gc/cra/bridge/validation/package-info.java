/**
 * Input validation shared by the CLI, configuration records and route table.
 * <p>Helpers are stateless and throw {@link java.lang.IllegalArgumentException} on invalid input.</p>
 */
package ca.gc.cra.bridge.validation;
