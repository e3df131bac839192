/**
 * Immutable schema model: commands, roles, options, option groups, and per-command rules.
 * <p><strong>Concurrency:</strong> Records and enums only; safe to share.</p>
 */
package ca.gc.cra.stratum.domain.option;
