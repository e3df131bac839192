/**
 * Ports the resolution engine depends on: the option schema and configuration file storage.
 */
package ca.gc.cra.stratum.application.port;
