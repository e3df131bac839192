package ca.gc.cra.stratum.infrastructure.schema;

/**
 * Raised when an option schema is malformed: bad YAML, unknown references, duplicate names, or
 * cyclic dependencies.
 *
 * @since 0.1.0
 */
public class SchemaException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
