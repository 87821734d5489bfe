package ca.gc.cra.veil.domain.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * File recovered from a carrier.
 *
 * @param name file name stored in the header
 * @param data file contents
 */
public record RecoveredBlob(String name, byte[] data) {
  public RecoveredBlob {
    Objects.requireNonNull(name, "name");
    data = Objects.requireNonNull(data, "data").clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  /** Length of the recovered file in bytes. */
  public int size() {
    return data.length;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RecoveredBlob that && name.equals(that.name) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "RecoveredBlob[name=" + name + ", size=" + data.length + "]";
  }
}
