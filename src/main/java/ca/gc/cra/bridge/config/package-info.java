/**
 * Configuration loading and composition.
 * <p>Settings are merged with precedence CLI over YAML over environment over defaults, validated into a
 * {@link ca.gc.cra.bridge.config.BridgeConfig}, then wired into a runnable
 * {@link ca.gc.cra.bridge.config.BridgeRuntime} by {@link ca.gc.cra.bridge.config.CompositionRoot}.</p>
 */
package ca.gc.cra.bridge.config;
