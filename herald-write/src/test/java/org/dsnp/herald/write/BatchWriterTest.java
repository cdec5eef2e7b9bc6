package org.dsnp.herald.write;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.dsnp.herald.AnnouncementFixtures;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.announcement.AnnouncementValidationException;
import org.dsnp.herald.announcement.Announcements;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.config.BatchConfig;
import org.dsnp.herald.io.Compression;
import org.dsnp.herald.read.BatchFormatException;
import org.dsnp.herald.read.BatchHandle;
import org.dsnp.herald.read.BatchReader;
import org.dsnp.herald.row.BatchRow;
import org.dsnp.herald.schema.UnsupportedAnnouncementTypeException;
import org.dsnp.herald.store.FileReadStore;
import org.dsnp.herald.store.FileWriteStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BatchWriterTest {
  private Path testDirectory;
  private FileWriteStore writeStore;
  private BatchReader reader;

  @BeforeEach
  public void setup() throws IOException {
    testDirectory = Files.createTempDirectory("batchstore");
    writeStore = new FileWriteStore(testDirectory);
    reader = new BatchReader(new FileReadStore(testDirectory));
  }

  @AfterEach
  public void cleanup() throws IOException {
    MoreFiles.deleteRecursively(testDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
  }

  private static List<SignedAnnouncement> broadcasts(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> AnnouncementFixtures.signed(AnnouncementFixtures.broadcast(i)))
        .collect(Collectors.toList());
  }

  @Test
  public void roundTripPreservesOrder() throws IOException {
    List<SignedAnnouncement> input = broadcasts(25);
    BatchArtifact artifact = new BatchWriter(writeStore).createBatch("batches/broadcast.batch", input);
    assertEquals(testDirectory.resolve("batches/broadcast.batch").toUri(), artifact.getUri());

    List<SignedAnnouncement> read = new ArrayList<>();
    try (BatchHandle handle = reader.open("batches/broadcast.batch")) {
      assertEquals(AnnouncementType.BROADCAST, handle.getAnnouncementType());
      assertEquals(25, handle.getNumRows());
      assertEquals(1, handle.getNumRowGroups());
      handle.forEachAnnouncement(read::add);
    }
    assertEquals(input, read);
  }

  @Test
  public void rowsCarryEverySchemaColumn() {
    SignedAnnouncement follow = AnnouncementFixtures.signed(AnnouncementFixtures.follow(7));
    new BatchWriter(writeStore).createBatch("graph.batch", Collections.singletonList(follow));

    List<BatchRow> rows = new ArrayList<>();
    try (BatchHandle handle = reader.open("graph.batch")) {
      handle.forEachRow(rows::add);
    }
    assertEquals(1, rows.size());
    BatchRow row = rows.get(0);
    assertEquals(Arrays.asList("changeType", "createdAt", "dsnpType", "fromId", "objectId", "signature"), row.getSchema().getColumnNames());
    assertEquals(1, row.get("changeType"));
    assertEquals(1700000000007L, row.get("createdAt"));
    assertEquals(1, row.get("dsnpType"));
    assertEquals("7", row.get("fromId"));
    assertEquals("0x8", row.get("objectId"));
    assertEquals(follow.getSignature(), row.get("signature"));
  }

  @Test
  public void contentHashCoversTheWrittenBytes() throws IOException {
    BatchArtifact artifact = new BatchWriter(writeStore).createBatch("a.batch", broadcasts(40));
    byte[] written = Files.readAllBytes(testDirectory.resolve("a.batch"));
    assertEquals(Hashing.sha256().hashBytes(written).toString(), artifact.getContentHash());
    assertEquals(64, artifact.getContentHash().length());
  }

  @Test
  public void sameInputSameBytes() throws IOException {
    BatchWriter writer = new BatchWriter(writeStore);
    BatchArtifact first = writer.createBatch("first.batch", broadcasts(100));
    BatchArtifact second = writer.createBatch("second.batch", broadcasts(100));
    assertEquals(first.getContentHash(), second.getContentHash());
    assertArrayEquals(Files.readAllBytes(testDirectory.resolve("first.batch")), Files.readAllBytes(testDirectory.resolve("second.batch")));

    BatchArtifact uncompressed = new BatchWriter(writeStore, BatchConfig.builder().compression(Compression.NONE).build())
        .createBatch("third.batch", broadcasts(100));
    assertNotEquals(first.getContentHash(), uncompressed.getContentHash());
  }

  @Test
  public void emptyBatch() {
    BatchWriter writer = new BatchWriter(writeStore);
    EmptyBatchException e = assertThrows(EmptyBatchException.class, () -> writer.createBatch("empty.batch", Collections.<SignedAnnouncement>emptyList()));
    assertEquals("empty.batch", e.getKey());
    assertFalse(writeStore.exists("empty.batch"));
    assertThrows(EmptyBatchException.class, () -> writer.createBatch("empty.batch", Stream.<SignedAnnouncement>empty()));
    assertFalse(writeStore.exists("empty.batch"));
  }

  @Test
  public void mixedTypes() throws IOException {
    List<SignedAnnouncement> input = new ArrayList<>(broadcasts(3));
    input.add(AnnouncementFixtures.signed(AnnouncementFixtures.reply(3)));
    input.addAll(broadcasts(2));

    MixedTypeBatchException e = assertThrows(MixedTypeBatchException.class, () -> new BatchWriter(writeStore).createBatch("mixed.batch", input));
    assertEquals(AnnouncementType.BROADCAST, e.getExpected());
    assertEquals(AnnouncementType.REPLY, e.getActual());
    assertEquals(3, e.getIndex());
    assertFalse(writeStore.exists("mixed.batch"));
    try (Stream<Path> files = Files.list(testDirectory)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  public void malformedAnnouncementsAreNotPublished() throws IOException {
    List<SignedAnnouncement> input = new ArrayList<>(broadcasts(2));
    input.add(AnnouncementFixtures.signed(Announcements.createBroadcast("1", "https://example.org/a", "0x12345")));
    input.addAll(broadcasts(2));

    AnnouncementValidationException e = assertThrows(AnnouncementValidationException.class,
        () -> new BatchWriter(writeStore).createBatch("malformed.batch", input));
    assertEquals("contentHash", e.getField());
    assertFalse(writeStore.exists("malformed.batch"));
    try (Stream<Path> files = Files.list(testDirectory)) {
      assertEquals(0, files.count());
    }

    SignedAnnouncement badSignature = new SignedAnnouncement(AnnouncementFixtures.broadcast(1), "0x1234");
    e = assertThrows(AnnouncementValidationException.class,
        () -> new BatchWriter(writeStore).createBatch("signature.batch", Collections.singletonList(badSignature)));
    assertEquals("signature", e.getField());
    assertFalse(writeStore.exists("signature.batch"));
  }

  @Test
  public void mixedTypeInALaterRowGroup() {
    BatchConfig config = BatchConfig.builder().rowGroupSize(4).build();
    Stream<SignedAnnouncement> input = Stream.concat(broadcasts(10).stream(),
        Stream.of(AnnouncementFixtures.signed(AnnouncementFixtures.profile(1))));
    MixedTypeBatchException e = assertThrows(MixedTypeBatchException.class, () -> new BatchWriter(writeStore, config).createBatch("late.batch", input));
    assertEquals(10, e.getIndex());
    assertFalse(writeStore.exists("late.batch"));
  }

  @Test
  public void tombstonesCannotBeBatched() {
    SignedAnnouncement tombstone = AnnouncementFixtures.signed(
        Announcements.createTombstone("1", 5L, AnnouncementType.BROADCAST, AnnouncementFixtures.SIGNATURE));
    assertThrows(UnsupportedAnnouncementTypeException.class,
        () -> new BatchWriter(writeStore).createBatch("tombstone.batch", Collections.singletonList(tombstone)));
    assertFalse(writeStore.exists("tombstone.batch"));
  }

  @Test
  public void multipleRowGroups() {
    BatchConfig config = BatchConfig.builder().rowGroupSize(10).build();
    List<SignedAnnouncement> input = IntStream.range(0, 95)
        .mapToObj(i -> AnnouncementFixtures.signed(AnnouncementFixtures.reaction(i)))
        .collect(Collectors.toList());
    new BatchWriter(writeStore, config).createBatch("reactions.batch", input.stream());

    List<SignedAnnouncement> read = new ArrayList<>();
    try (BatchHandle handle = reader.open("reactions.batch")) {
      assertEquals(10, handle.getNumRowGroups());
      assertEquals(95, handle.getNumRows());
      handle.forEachAnnouncement(read::add);
      for (int i = 0; i < 95; i++)
        assertTrue(handle.probe("fromId", Integer.toString(i)), "fromId " + i);
      assertTrue(handle.probe("emoji", "👍"));
      assertTrue(handle.probe("inReplyTo", AnnouncementFixtures.IN_REPLY_TO));
    }
    assertEquals(input, read);
  }

  @Test
  public void probeHasNoFalseNegativesAndFewFalsePositives() {
    new BatchWriter(writeStore).createBatch("probe.batch", broadcasts(1000));
    try (BatchHandle handle = reader.open("probe.batch")) {
      for (int i = 0; i < 1000; i++)
        assertTrue(handle.probe("fromId", Integer.toString(i)));
      int falsePositives = 0;
      for (int i = 100000; i < 110000; i++) {
        if (handle.probe("fromId", Integer.toString(i)))
          falsePositives++;
      }
      assertTrue(falsePositives < 300, "Too many false positives: " + falsePositives);
    }
  }

  @Test
  public void probeRequiresAnIndexedColumn() {
    new BatchWriter(writeStore).createBatch("index.batch", broadcasts(3));
    try (BatchHandle handle = reader.open("index.batch")) {
      assertThrows(IllegalArgumentException.class, () -> handle.probe("url", "https://example.org/1"));
      assertThrows(IllegalArgumentException.class, () -> handle.probe("inReplyTo", AnnouncementFixtures.IN_REPLY_TO));
      assertThrows(IllegalArgumentException.class, () -> handle.probe("fromId", 1));
    }
  }

  @Test
  public void closeIsIdempotent() {
    new BatchWriter(writeStore).createBatch("close.batch", broadcasts(2));
    BatchHandle handle = reader.open("close.batch");
    handle.close();
    handle.close();
    assertTrue(handle.isClosed());
    assertThrows(IllegalStateException.class, () -> handle.forEachRow(row -> { }));
    assertThrows(IllegalStateException.class, () -> handle.probe("fromId", "1"));
  }

  @Test
  public void readerRejectsForeignFiles() throws IOException {
    writeStore.put("foreign.batch", new byte[64]);
    assertThrows(BatchFormatException.class, () -> reader.open("foreign.batch"));

    writeStore.put("tiny.batch", new byte[] {1, 2, 3});
    assertThrows(BatchFormatException.class, () -> reader.open("tiny.batch"));

    new BatchWriter(writeStore).createBatch("truncated.batch", broadcasts(5));
    Path truncated = testDirectory.resolve("truncated.batch");
    byte[] bytes = Files.readAllBytes(truncated);
    Files.write(truncated, Arrays.copyOf(bytes, bytes.length - 1));
    assertThrows(BatchFormatException.class, () -> reader.open("truncated.batch"));
  }

  @Test
  public void uncompressedBatchesReadBack() {
    BatchConfig config = BatchConfig.builder().compression(Compression.NONE).rowGroupSize(3).build();
    List<SignedAnnouncement> input = IntStream.range(0, 7)
        .mapToObj(i -> AnnouncementFixtures.signed(AnnouncementFixtures.follow(i)))
        .collect(Collectors.toList());
    new BatchWriter(writeStore, config).createBatch("plain.batch", input.iterator());

    List<SignedAnnouncement> read = new ArrayList<>();
    try (BatchHandle handle = reader.open("plain.batch")) {
      assertEquals(3, handle.getNumRowGroups());
      handle.forEachAnnouncement(read::add);
      assertTrue(handle.probe("fromId", "6"));
    }
    assertEquals(input, read);
  }
}
