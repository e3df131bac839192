/**
 * Command-line entry point that resolves and prints the configuration of one invocation.
 * <p><strong>Role:</strong> Adapter layer on the driving side; loads the bundled schema, wires the
 * file-system storage and SLF4J warning sink, and maps resolution errors to exit codes.</p>
 * <p><strong>Security:</strong> Secure option values are redacted before printing.</p>
 */
package ca.gc.cra.stratum.api;
