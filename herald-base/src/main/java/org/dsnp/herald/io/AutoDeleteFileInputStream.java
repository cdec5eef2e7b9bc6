package org.dsnp.herald.io;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Input over a local spool file that is removed once the stream is closed, whether or not the consumer read it to
 * the end. The length is captured on open so callers can announce it before streaming.
 */
public class AutoDeleteFileInputStream extends FileInputStream {
  private static final Logger LOGGER = LoggerFactory.getLogger(AutoDeleteFileInputStream.class);
  private final Path path;
  private final long length;
  private boolean closed;

  public AutoDeleteFileInputStream(Path path) throws IOException {
    super(path.toFile());
    this.path = path;
    this.length = Files.size(path);
  }

  public Path getPath() {
    return path;
  }

  public long getLength() {
    return length;
  }

  @Override
  public void close() throws IOException {
    if (closed)
      return;
    closed = true;
    try {
      super.close();
    } finally {
      if (!Files.deleteIfExists(path))
        LOGGER.warn("The spool file {} was already gone on close", path);
    }
  }
}
