/**
 * Logging helpers: Logback level control and redaction of secure option values.
 */
package ca.gc.cra.stratum.logging;
