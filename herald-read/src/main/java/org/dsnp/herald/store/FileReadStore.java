package org.dsnp.herald.store;

import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class FileReadStore implements ReadStore {
  private final Path basePath;

  public FileReadStore(Path path) {
    this.basePath = path.toAbsolutePath().normalize();
  }

  public Path getBasePath() {
    return basePath;
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public long size(String key) {
    try {
      return Files.size(resolve(key));
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to size " + key, ioe);
    }
  }

  @Override
  public byte[] get(String key) {
    try {
      return Files.readAllBytes(resolve(key));
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to read " + key, ioe);
    }
  }

  @Override
  public InputStream getRange(String key, long offset, long length) {
    if (offset < 0 || length < 0)
      throw new IllegalArgumentException("Invalid range offset=" + offset + " length=" + length);
    FileChannel channel = null;
    try {
      channel = FileChannel.open(resolve(key), StandardOpenOption.READ);
      channel.position(offset);
      return ByteStreams.limit(Channels.newInputStream(channel), length);
    } catch (IOException ioe) {
      if (channel != null) {
        try {
          channel.close();
        } catch (IOException closeError) {
          ioe.addSuppressed(closeError);
        }
      }
      throw new UncheckedIOException("Unable to read " + key + " at offset " + offset, ioe);
    }
  }

  private Path resolve(String key) {
    Path resolved = basePath.resolve(key).normalize();
    if (!resolved.startsWith(basePath))
      throw new IllegalArgumentException("The key " + key + " resolves outside of " + basePath);
    return resolved;
  }
}
