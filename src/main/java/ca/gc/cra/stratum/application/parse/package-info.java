/**
 * Phased resolution of one invocation's configuration: tokenizer, occurrence store, environment
 * mapper, configuration file loader, section resolver, group index compactor, and value resolver.
 * <p><strong>Role:</strong> Application layer; {@link ca.gc.cra.stratum.application.parse.ConfigParser}
 * is the entry point and every phase shares one {@link ca.gc.cra.stratum.application.parse.ParseContext}.</p>
 * <p><strong>Concurrency:</strong> Single-threaded per pass; parsers are reusable.</p>
 * <p><strong>Security:</strong> Secure options are rejected on the command line.</p>
 */
package ca.gc.cra.stratum.application.parse;
