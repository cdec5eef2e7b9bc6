package org.dsnp.herald.store;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.google.common.io.ByteStreams;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.dsnp.herald.io.IOTools;
import org.dsnp.herald.io.PathBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class S3ReadStore implements ReadStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3ReadStore.class);
  private final AmazonS3 s3Client;
  private final String bucket;
  private final String prefix;

  public S3ReadStore(AmazonS3 s3Client, String bucket) {
    this(s3Client, bucket, "");
  }

  public S3ReadStore(AmazonS3 s3Client, String bucket, String prefix) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public boolean exists(String key) {
    return s3Client.doesObjectExist(bucket, objectKey(key));
  }

  @Override
  public long size(String key) {
    return s3Client.getObjectMetadata(bucket, objectKey(key)).getContentLength();
  }

  @Override
  public byte[] get(String key) {
    S3Object s3Object = s3Client.getObject(bucket, objectKey(key));
    try (InputStream in = s3Object.getObjectContent()) {
      return ByteStreams.toByteArray(in);
    } catch (IOException ioe) {
      LOGGER.error("Unable to read s3://{}/{}", bucket, objectKey(key), ioe);
      throw new UncheckedIOException(ioe);
    }
  }

  @Override
  public InputStream getRange(String key, long offset, long length) {
    if (offset < 0 || length < 0)
      throw new IllegalArgumentException("Invalid range offset=" + offset + " length=" + length);
    if (length == 0)
      return new ByteArrayInputStream(new byte[0]);
    GetObjectRequest request = new GetObjectRequest(bucket, objectKey(key)).withRange(offset, offset + length - 1);
    S3Object s3Object = s3Client.getObject(request);
    InputStream in = s3Object.getObjectContent();
    ObjectMetadata metadata = s3Object.getObjectMetadata();
    try {
      // Some S3 compatible servers ignore the range header and return the whole object
      if (metadata.getContentLength() > length) {
        LOGGER.warn("Ranged read of s3://{}/{} returned {} bytes instead of {}", bucket, objectKey(key), metadata.getContentLength(), length);
        IOTools.skipFully(in, offset);
      }
      return ByteStreams.limit(in, length);
    } catch (IOException ioe) {
      try {
        in.close();
      } catch (IOException closeError) {
        ioe.addSuppressed(closeError);
      }
      throw new UncheckedIOException(ioe);
    }
  }

  private String objectKey(String key) {
    return PathBuilder.buildPath(prefix, key);
  }
}
