package org.dsnp.herald.write;

import java.net.URI;
import java.util.Objects;

/**
 * Where a batch was published and the hash of its exact bytes.
 */
public final class BatchArtifact {
  private final URI uri;
  private final String contentHash;

  public BatchArtifact(URI uri, String contentHash) {
    this.uri = Objects.requireNonNull(uri, "The uri cannot be null");
    this.contentHash = Objects.requireNonNull(contentHash, "The content hash cannot be null");
  }

  public URI getUri() {
    return uri;
  }

  /**
   * @return Lower case hex digest without a {@code 0x} prefix.
   */
  public String getContentHash() {
    return contentHash;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BatchArtifact that = (BatchArtifact) o;
    return uri.equals(that.uri) && contentHash.equals(that.contentHash);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, contentHash);
  }

  @Override
  public String toString() {
    return "BatchArtifact{" +
        "uri=" + uri +
        ", contentHash='" + contentHash + '\'' +
        '}';
  }
}
