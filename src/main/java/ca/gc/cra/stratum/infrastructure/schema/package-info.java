/**
 * YAML-backed option schema with load-time validation and dependency ordering.
 */
package ca.gc.cra.stratum.infrastructure.schema;
