package ca.gc.cra.veil.infrastructure.persistence;

import ca.gc.cra.veil.application.port.PayloadFilePort;
import ca.gc.cra.veil.validation.Strings;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Reads secret files and writes recovered ones using the {@code recovered_<name>} convention.
 *
 * @since 0.1.0
 */
public final class FilePayloadAdapter implements PayloadFilePort {
  /** Prefix of every recovered file name. */
  public static final String RECOVERED_PREFIX = "recovered_";

  @Override
  public byte[] read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return Files.readAllBytes(path);
  }

  /**
   * {@inheritDoc}
   *
   * @implNote The stored name is reduced to letters, digits, {@code -}, {@code _} and {@code .}
   *     before the prefix is added.
   */
  @Override
  public synchronized Path writeRecovered(Path directory, String originalName, byte[] data, boolean allowOverwrite)
      throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(data, "data");
    Files.createDirectories(directory);
    Path target = directory.resolve(recoveredName(originalName));
    if (allowOverwrite) {
      Files.write(target, data);
    } else {
      try {
        Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      } catch (FileAlreadyExistsException ex) {
        throw new IOException(target + " already exists; re-run with --allow-overwrite to replace it", ex);
      }
    }
    return target;
  }

  /**
   * Name a recovered file is written under.
   *
   * @param originalName name stored in the carrier header
   * @return {@code recovered_} followed by the sanitized name
   */
  public static String recoveredName(String originalName) {
    return RECOVERED_PREFIX + Strings.sanitizeFileName(originalName);
  }
}
