package org.dsnp.herald.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.AnonymousAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import io.findify.s3mock.S3Mock;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.dsnp.herald.AnnouncementFixtures;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.config.BatchConfig;
import org.dsnp.herald.read.BatchHandle;
import org.dsnp.herald.read.BatchReader;
import org.dsnp.herald.write.BatchArtifact;
import org.dsnp.herald.write.BatchWriter;
import org.dsnp.herald.write.MixedTypeBatchException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class S3StoreTest {
  private static final String TEST_BUCKET = "testbucket";
  private static final S3Mock S3_MOCK = new S3Mock.Builder().withPort(8001).withInMemoryBackend().build();
  private static AmazonS3 client;

  @BeforeAll
  public static void setupBucket() {
    S3_MOCK.start();
    EndpointConfiguration endpoint = new EndpointConfiguration("http://localhost:8001", "us-west-2");
    client = AmazonS3ClientBuilder
        .standard()
        .withPathStyleAccessEnabled(true)
        .withEndpointConfiguration(endpoint)
        .withCredentials(new AWSStaticCredentialsProvider(new AnonymousAWSCredentials()))
        .build();
    client.createBucket(TEST_BUCKET);
  }

  @AfterAll
  public static void shutdown() {
    S3_MOCK.shutdown();
  }

  @Test
  public void putAndRangedReads() throws IOException {
    S3WriteStore writeStore = new S3WriteStore(client, TEST_BUCKET, "ranges");
    S3ReadStore readStore = new S3ReadStore(client, TEST_BUCKET, "ranges");
    URI uri = writeStore.put("digits", "0123456789".getBytes(StandardCharsets.US_ASCII));
    assertEquals(URI.create("s3://testbucket/ranges/digits"), uri);
    assertTrue(readStore.exists("digits"));
    assertEquals(10, readStore.size("digits"));
    assertArrayEquals("0123456789".getBytes(StandardCharsets.US_ASCII), readStore.get("digits"));
    try (InputStream in = readStore.getRange("digits", 6, 3)) {
      assertEquals("678", new String(ByteStreams.toByteArray(in), StandardCharsets.US_ASCII));
    }

    writeStore.delete("digits");
    assertFalse(readStore.exists("digits"));
  }

  @Test
  public void batchRoundTrip() {
    S3WriteStore writeStore = new S3WriteStore(client, TEST_BUCKET, "batches");
    BatchReader reader = new BatchReader(new S3ReadStore(client, TEST_BUCKET, "batches"));
    List<SignedAnnouncement> input = IntStream.range(0, 50)
        .mapToObj(i -> AnnouncementFixtures.signed(AnnouncementFixtures.reply(i)))
        .collect(Collectors.toList());

    BatchArtifact artifact = new BatchWriter(writeStore, BatchConfig.builder().rowGroupSize(20).build())
        .createBatch("replies.batch", input);
    assertEquals(URI.create("s3://testbucket/batches/replies.batch"), artifact.getUri());
    byte[] stored = new S3ReadStore(client, TEST_BUCKET, "batches").get("replies.batch");
    assertEquals(Hashing.sha256().hashBytes(stored).toString(), artifact.getContentHash());

    List<SignedAnnouncement> read = new ArrayList<>();
    try (BatchHandle handle = reader.open("replies.batch")) {
      assertEquals(3, handle.getNumRowGroups());
      handle.forEachAnnouncement(read::add);
      assertTrue(handle.probe("fromId", "49"));
      assertTrue(handle.probe("inReplyTo", AnnouncementFixtures.IN_REPLY_TO));
    }
    assertEquals(input, read);
  }

  @Test
  public void failedWritesUploadNothing() {
    S3WriteStore writeStore = new S3WriteStore(client, TEST_BUCKET, "failures");
    List<SignedAnnouncement> input = new ArrayList<>();
    input.add(AnnouncementFixtures.signed(AnnouncementFixtures.profile(1)));
    input.add(AnnouncementFixtures.signed(AnnouncementFixtures.broadcast(2)));
    assertThrows(MixedTypeBatchException.class, () -> new BatchWriter(writeStore).createBatch("mixed.batch", input));
    assertFalse(writeStore.exists("mixed.batch"));
  }

  @Test
  public void spoolsInTheConfiguredDirectory() throws IOException {
    Path spoolDirectory = Files.createTempDirectory("s3spool");
    try {
      S3WriteStore writeStore = new S3WriteStore(client, TEST_BUCKET, "spooled", spoolDirectory);
      assertEquals(spoolDirectory, writeStore.getSpoolDirectory());

      List<Path> seen = new ArrayList<>();
      writeStore.putStream("profile.batch", out -> {
        try (Stream<Path> files = Files.list(spoolDirectory)) {
          files.forEach(seen::add);
        }
        out.write(new byte[] {1, 2, 3});
      });
      assertEquals(1, seen.size());
      assertTrue(seen.get(0).getFileName().toString().startsWith("herald-profile.batch-"));
      assertEquals(3, new S3ReadStore(client, TEST_BUCKET, "spooled").size("profile.batch"));

      List<SignedAnnouncement> input = new ArrayList<>();
      input.add(AnnouncementFixtures.signed(AnnouncementFixtures.profile(1)));
      input.add(AnnouncementFixtures.signed(AnnouncementFixtures.broadcast(2)));
      assertThrows(MixedTypeBatchException.class, () -> new BatchWriter(writeStore).createBatch("mixed.batch", input));
      assertFalse(writeStore.exists("mixed.batch"));

      try (Stream<Path> files = Files.list(spoolDirectory)) {
        assertEquals(0, files.count());
      }
    } finally {
      MoreFiles.deleteRecursively(spoolDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
    }
  }
}
