package ca.gc.cra.stratum.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Port for the file-system reads performed while loading configuration files.
 * <p><strong>Role:</strong> Consumed by {@link ca.gc.cra.stratum.application.parse.ConfigFileLoader};
 * implemented by {@link ca.gc.cra.stratum.infrastructure.storage.LocalConfigStorage}.</p>
 *
 * @since 0.1.0
 */
public interface ConfigStorage {
  /**
   * Reads a UTF-8 text file.
   *
   * @param path file to read
   * @param ignoreMissing when {@code true} a missing file yields an empty result
   * @return file content, or empty when missing and {@code ignoreMissing}
   * @throws java.nio.file.NoSuchFileException when missing and not {@code ignoreMissing}
   * @throws IOException when the file exists but cannot be read
   */
  Optional<String> read(Path path, boolean ignoreMissing) throws IOException;

  /**
   * Lists the names of the entries of a directory, without recursing, whose name matches
   * {@code pattern}.
   *
   * @param directory directory to list
   * @param pattern full-match filter applied to entry names
   * @param errorOnMissing when {@code false} a missing directory yields an empty result
   * @return matching names in no particular order, or empty when missing and not
   *     {@code errorOnMissing}
   * @throws java.nio.file.NoSuchFileException when missing and {@code errorOnMissing}
   * @throws IOException when the directory cannot be read
   */
  Optional<List<String>> list(Path directory, Pattern pattern, boolean errorOnMissing) throws IOException;
}
