package ca.gc.cra.stratum.infrastructure.storage;

import ca.gc.cra.stratum.application.port.ConfigStorage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConfigStorage} backed by the local file system.
 *
 * @since 0.1.0
 */
public final class LocalConfigStorage implements ConfigStorage {
  private static final Logger log = LoggerFactory.getLogger(LocalConfigStorage.class);

  @Override
  public Optional<String> read(Path path, boolean ignoreMissing) throws IOException {
    Objects.requireNonNull(path, "path");
    try {
      String text = Files.readString(path, StandardCharsets.UTF_8);
      log.debug("Read configuration file {} ({} chars)", path, text.length());
      return Optional.of(text);
    } catch (NoSuchFileException ex) {
      if (ignoreMissing) {
        log.debug("Configuration file {} not found", path);
        return Optional.empty();
      }
      throw ex;
    }
  }

  @Override
  public Optional<List<String>> list(Path directory, Pattern pattern, boolean errorOnMissing)
      throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(pattern, "pattern");
    if (!Files.exists(directory)) {
      if (errorOnMissing) {
        throw new NoSuchFileException(directory.toString());
      }
      return Optional.empty();
    }
    if (!Files.isDirectory(directory)) {
      throw new NotDirectoryException(directory.toString());
    }

    List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (Files.isRegularFile(entry) && pattern.matcher(name).matches()) {
          names.add(name);
        }
      }
    }
    return Optional.of(names);
  }
}
