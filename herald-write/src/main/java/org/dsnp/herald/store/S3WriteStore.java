package org.dsnp.herald.store;

import com.amazonaws.ResetException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.dsnp.herald.io.AutoDeleteFileInputStream;
import org.dsnp.herald.io.PathBuilder;
import org.dsnp.herald.write.TempFileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores objects in an S3 bucket. Streamed content is spooled to a local temp file first so the upload has a
 * known length, the spool file is removed once uploaded.
 */
public class S3WriteStore implements WriteStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3WriteStore.class);
  private final AmazonS3 s3Client;
  private final String bucket;
  private final String prefix;
  private final Path spoolDirectory;

  public S3WriteStore(AmazonS3 s3Client, String bucket) {
    this(s3Client, bucket, "");
  }

  public S3WriteStore(AmazonS3 s3Client, String bucket, String prefix) {
    this(s3Client, bucket, prefix, TempFileUtil.defaultSpoolDirectory());
  }

  /**
   * @param spoolDirectory Local directory streamed content is staged in before upload.
   */
  public S3WriteStore(AmazonS3 s3Client, String bucket, String prefix, Path spoolDirectory) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
    this.spoolDirectory = Objects.requireNonNull(spoolDirectory, "The spool directory cannot be null");
  }

  public Path getSpoolDirectory() {
    return spoolDirectory;
  }

  @Override
  public URI put(String key, byte[] payload) {
    return putStream(key, out -> out.write(payload));
  }

  @Override
  public URI putStream(String key, StreamWriter writer) {
    String objectKey = objectKey(key);
    Path spool;
    try {
      spool = TempFileUtil.createSpoolFile(spoolDirectory, objectKey);
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to create a spool file for " + objectKey, ioe);
    }

    boolean handedOff = false;
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(spool))) {
        writer.write(out);
      }
      AutoDeleteFileInputStream spoolStream = new AutoDeleteFileInputStream(spool);
      handedOff = true;
      long size = spoolStream.getLength();
      ObjectMetadata omd = new ObjectMetadata();
      omd.setContentLength(size);
      try (InputStream in = spoolStream) {
        PutObjectRequest putObjectRequest = new PutObjectRequest(bucket, objectKey, in, omd);
        putObjectRequest.getRequestClientOptions().setReadLimit((int) Math.min(Integer.MAX_VALUE, size + 1));
        s3Client.putObject(putObjectRequest);
      } catch (ResetException e) {
        LOGGER.error("Detected a reset exception, the number of bytes is {}: {}", size, e.getExtraInfo());
        throw e;
      }
      LOGGER.debug("Uploaded {} bytes to s3://{}/{}", size, bucket, objectKey);
      return URI.create("s3://" + bucket + "/" + objectKey);
    } catch (IOException ioe) {
      throw new UncheckedIOException("Unable to upload " + objectKey, ioe);
    } finally {
      if (!handedOff)
        TempFileUtil.deleteQuietly(spool);
    }
  }

  @Override
  public boolean exists(String key) {
    return s3Client.doesObjectExist(bucket, objectKey(key));
  }

  @Override
  public void delete(String key) {
    s3Client.deleteObject(bucket, objectKey(key));
  }

  private String objectKey(String key) {
    return PathBuilder.buildPath(prefix, key);
  }
}
