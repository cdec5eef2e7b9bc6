package org.dsnp.herald.write;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashingOutputStream;
import java.net.URI;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.announcement.AnnouncementValidator;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.config.BatchConfig;
import org.dsnp.herald.schema.BatchSchema;
import org.dsnp.herald.schema.BloomFilterSpec;
import org.dsnp.herald.schema.SchemaSelector;
import org.dsnp.herald.store.WriteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs a stream of signed announcements of a single type into a batch file and publishes it to a
 * {@link WriteStore}. The content hash is computed over the bytes as they stream to the store, the file is never
 * re-read.
 */
public class BatchWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchWriter.class);
  private final WriteStore store;
  private final BatchConfig config;

  public BatchWriter(WriteStore store) {
    this(store, BatchConfig.DEFAULT);
  }

  public BatchWriter(WriteStore store, BatchConfig config) {
    this.store = Objects.requireNonNull(store, "The write store cannot be null");
    this.config = Objects.requireNonNull(config, "The config cannot be null");
  }

  public BatchConfig getConfig() {
    return config;
  }

  public BatchArtifact createBatch(String key, Iterable<SignedAnnouncement> announcements) {
    return createBatch(key, announcements.iterator());
  }

  /**
   * The stream is closed once the batch is written or has failed.
   */
  public BatchArtifact createBatch(String key, Stream<SignedAnnouncement> announcements) {
    try (Stream<SignedAnnouncement> stream = announcements) {
      return createBatch(key, stream.iterator());
    }
  }

  /**
   * Writes the announcements as a batch under the given key. Row order matches input order.
   *
   * @param key The store key to publish under.
   * @param announcements The announcements, all of the same type. The iterator is consumed once.
   *
   * @return The location and content hash of the published batch.
   *
   * @throws EmptyBatchException If there are no announcements, the store is not touched.
   * @throws MixedTypeBatchException If an announcement differs in type from the first, nothing is published.
   * @throws org.dsnp.herald.announcement.AnnouncementValidationException If an announcement is malformed, nothing
   *     is published.
   * @throws org.dsnp.herald.schema.UnsupportedAnnouncementTypeException If the type cannot be batched.
   */
  public BatchArtifact createBatch(String key, Iterator<SignedAnnouncement> announcements) {
    Objects.requireNonNull(key, "The key cannot be null");
    PeekingIterator<SignedAnnouncement> iterator = Iterators.peekingIterator(announcements);
    if (!iterator.hasNext())
      throw new EmptyBatchException(key);

    SignedAnnouncement first = Objects.requireNonNull(iterator.peek(), "Announcements cannot be null");
    AnnouncementType type = first.getAnnouncementType();
    BatchSchema schema = SchemaSelector.schemaFor(type);
    BloomFilterSpec bloomFilterSpec = SchemaSelector.bloomFilterSpecFor(type);

    AtomicReference<HashCode> contentHash = new AtomicReference<>();
    AtomicReference<BatchFileWriter> completed = new AtomicReference<>();
    URI uri = store.putStream(key, sink -> {
      HashingOutputStream hashingSink = new HashingOutputStream(config.getContentHashFunction(), sink);
      BatchFileWriter fileWriter = new BatchFileWriter(hashingSink, type, schema, bloomFilterSpec, config);
      fileWriter.writeHeader();
      long index = 0;
      while (iterator.hasNext()) {
        SignedAnnouncement announcement = Objects.requireNonNull(iterator.next(), "Announcements cannot be null");
        if (announcement.getAnnouncementType() != type)
          throw new MixedTypeBatchException(type, announcement.getAnnouncementType(), index);
        // Rows are validated as the reader validates them
        fileWriter.append(AnnouncementValidator.validateSigned(announcement));
        index++;
      }
      fileWriter.finish();
      contentHash.set(hashingSink.hash());
      completed.set(fileWriter);
    });

    BatchFileWriter fileWriter = completed.get();
    LOGGER.debug("Published {} {} announcements in {} row groups to {}", fileWriter.getNumRows(), type, fileWriter.getNumRowGroups(), uri);
    return new BatchArtifact(uri, contentHash.get().toString());
  }
}
