/**
 * Runnable walkthrough of the logkit API.
 */
package ca.gc.cra.logkit.sample;
