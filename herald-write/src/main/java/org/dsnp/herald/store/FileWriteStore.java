package org.dsnp.herald.store;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores objects as files under a base directory. Content is written to a hidden temp file next to the target and
 * moved into place once complete, so readers never observe a partial file.
 */
public class FileWriteStore implements WriteStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileWriteStore.class);
  private static final String TEMP_SUFFIX = ".tmp";
  private final Path basePath;

  public FileWriteStore(Path path) {
    this.basePath = path.toAbsolutePath().normalize();
  }

  public Path getBasePath() {
    return basePath;
  }

  @Override
  public URI put(String key, byte[] payload) {
    return putStream(key, out -> out.write(payload));
  }

  @Override
  public URI putStream(String key, StreamWriter writer) {
    Path target = resolve(key);
    Path temp;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), TEMP_SUFFIX);
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to stage " + key, ioe);
    }

    boolean published = false;
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
        writer.write(out);
      }
      move(temp, target);
      published = true;
      LOGGER.debug("Stored {} bytes at {}", Files.size(target), target);
      return target.toUri();
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to write " + key, ioe);
    } finally {
      if (!published)
        deleteQuietly(temp);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to delete " + key, ioe);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, REPLACE_EXISTING, ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.warn("Atomic moves are not supported for {}, falling back to a plain move", target);
      Files.move(source, target, REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ioe) {
      LOGGER.error("Unable to remove the partial file {}", path, ioe);
    }
  }

  private Path resolve(String key) {
    Path resolved = basePath.resolve(key).normalize();
    if (!resolved.startsWith(basePath) || resolved.equals(basePath))
      throw new IllegalArgumentException("The key " + key + " resolves outside of " + basePath);
    return resolved;
  }
}
