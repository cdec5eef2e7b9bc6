package org.dsnp.herald.store;

import java.net.URI;

/**
 * Write access to the location batch files are published to. Keys are store relative paths delimited by
 * {@code /}.
 */
public interface WriteStore {

  /**
   * Stores an object, replacing any existing object under the same key.
   *
   * @return The location of the stored object.
   */
  URI put(String key, byte[] payload);

  /**
   * Streams an object into the store. Nothing is published if the writer throws, any partial output is discarded
   * and the writer's exception propagates unchanged.
   *
   * @param key The key to store under.
   * @param writer Produces the object content.
   *
   * @return The location of the stored object.
   */
  URI putStream(String key, StreamWriter writer);

  boolean exists(String key);

  void delete(String key);
}
