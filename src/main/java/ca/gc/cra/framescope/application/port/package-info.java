/**
 * Ports between the observer and its host: frame delivery, serialization, decoding, metrics and time.
 */
package ca.gc.cra.framescope.application.port;
