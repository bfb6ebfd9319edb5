/**
 * Observer configuration records, the YAML loader, and the composition root.
 * <p>Precedence is CLI over YAML over built-in defaults. Invalid values fail fast with
 * {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.framescope.config;
