package org.dsnp.herald.store;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Callback that produces the content of an object. The store publishes the object only if the callback returns
 * normally.
 */
@FunctionalInterface
public interface StreamWriter {
  void write(OutputStream out) throws IOException;
}
