package org.dsnp.herald.signing;

/**
 * Retrieves externally hosted content referenced by an announcement url.
 */
public interface ContentFetcher {
  byte[] fetch(String url);
}
