/**
 * Configuration loading and composition of the logkit facade.
 *
 * <p>Settings are merged from built-in defaults, an optional YAML document and {@code logkit.*} system properties,
 * in increasing order of precedence.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.config;
