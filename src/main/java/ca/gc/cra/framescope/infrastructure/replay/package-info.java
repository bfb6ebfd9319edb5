/** Reading recorded frame logs for replay. */
package ca.gc.cra.framescope.infrastructure.replay;
