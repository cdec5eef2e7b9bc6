package org.dsnp.herald.write;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local spool files for stores that need the full object before they can upload it.
 */
public class TempFileUtil {
  private static final Logger LOGGER = LoggerFactory.getLogger(TempFileUtil.class);
  private static final int MAX_NAME_LENGTH = 32;

  /**
   * @return {@code java.io.tmpdir}.
   */
  public static Path defaultSpoolDirectory() {
    return Paths.get(System.getProperty("java.io.tmpdir"));
  }

  /**
   * Creates an empty spool file named after the last segment of a store key.
   *
   * @param directory Where the spool file goes, created if missing.
   * @param key The store key the content is destined for.
   */
  public static Path createSpoolFile(Path directory, String key) throws IOException {
    Files.createDirectories(directory);
    return Files.createTempFile(directory, "herald-" + spoolName(key) + "-", ".spool");
  }

  public static void deleteQuietly(Path spool) {
    try {
      Files.deleteIfExists(spool);
    } catch (IOException ioe) {
      LOGGER.error("Unable to remove the spool file {}", spool, ioe);
    }
  }

  static String spoolName(String key) {
    String name = key == null ? "" : key.substring(key.lastIndexOf('/') + 1);
    name = name.replaceAll("[^A-Za-z0-9._-]", "_");
    if (name.length() > MAX_NAME_LENGTH)
      name = name.substring(name.length() - MAX_NAME_LENGTH);
    return name.isEmpty() ? "object" : name;
  }

  private TempFileUtil() {}
}
