package ca.gc.cra.veil.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for reading secret files and writing recovered ones.
 * <p><strong>Role:</strong> Domain port implemented by infrastructure adapters.</p>
 * <p><strong>Contract:</strong> recovered files are named {@code recovered_<name>} with the stored
 * name reduced to safe file-name characters, so a crafted header cannot escape the target
 * directory.</p>
 *
 * @since 0.1.0
 */
public interface PayloadFilePort {
  /**
   * Reads a whole file.
   *
   * @param path file to read
   * @return file contents
   * @throws IOException if the file cannot be read
   */
  byte[] read(Path path) throws IOException;

  /**
   * Writes a recovered file.
   *
   * @param directory target directory
   * @param originalName name stored in the carrier header
   * @param data file contents
   * @param allowOverwrite whether an existing file may be replaced
   * @return path of the written file
   * @throws IOException if the file exists without permission to overwrite or cannot be written
   */
  Path writeRecovered(Path directory, String originalName, byte[] data, boolean allowOverwrite) throws IOException;
}
