package org.dsnp.herald.signing;

import com.google.common.hash.HashCode;
import java.util.Objects;
import org.dsnp.herald.announcement.AnnouncementType;
import org.dsnp.herald.announcement.AnnouncementValidationException;
import org.dsnp.herald.announcement.AnnouncementValidator;
import org.dsnp.herald.announcement.BroadcastAnnouncement;
import org.dsnp.herald.announcement.Identifiers;
import org.dsnp.herald.announcement.ReplyAnnouncement;
import org.dsnp.herald.announcement.SignedAnnouncement;
import org.dsnp.herald.config.BatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Full validity check of a signed announcement: structure, signature authorization and, for broadcasts and replies,
 * integrity of the referenced content. Failures of the collaborators are not caught.
 */
public class AnnouncementVerifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnnouncementVerifier.class);
  private final Signer signer;
  private final PermissionResolver permissionResolver;
  private final ContentFetcher contentFetcher;
  private final BatchConfig config;

  public AnnouncementVerifier(Signer signer, PermissionResolver permissionResolver, ContentFetcher contentFetcher, BatchConfig config) {
    this.signer = Objects.requireNonNull(signer, "The signer cannot be null");
    this.permissionResolver = Objects.requireNonNull(permissionResolver, "The permission resolver cannot be null");
    this.contentFetcher = contentFetcher;
    this.config = Objects.requireNonNull(config, "The config cannot be null");
  }

  public AnnouncementVerifier(Signer signer, PermissionResolver permissionResolver, ContentFetcher contentFetcher) {
    this(signer, permissionResolver, contentFetcher, BatchConfig.DEFAULT);
  }

  /**
   * Verifier that skips the content check, for deployments with no way to fetch content.
   */
  public AnnouncementVerifier(Signer signer, PermissionResolver permissionResolver) {
    this(signer, permissionResolver, null, BatchConfig.DEFAULT);
  }

  /**
   * @param obj A signed announcement, either typed or as an untyped record.
   *
   * @return {@code true} if every check passes.
   */
  public boolean isValidAnnouncement(Object obj) {
    SignedAnnouncement signed;
    try {
      signed = obj instanceof SignedAnnouncement
          ? AnnouncementValidator.validateSigned((SignedAnnouncement) obj)
          : AnnouncementValidator.validateSigned(obj);
    } catch (AnnouncementValidationException ave) {
      LOGGER.debug("Rejecting announcement that failed validation: {}", ave.getMessage());
      return false;
    }

    String fromId = signed.getAnnouncement().getFromId();
    String identity = AnnouncementSigner.recoverSigner(signed, signer);
    if (identity == null || !permissionResolver.isAuthorized(identity, fromId, Permission.ANNOUNCE)) {
      LOGGER.debug("Signer {} is not authorized to announce for {}", identity, fromId);
      return false;
    }

    AnnouncementType type = signed.getAnnouncementType();
    if (contentFetcher != null && (type == AnnouncementType.BROADCAST || type == AnnouncementType.REPLY)) {
      String url;
      String contentHash;
      if (type == AnnouncementType.BROADCAST) {
        BroadcastAnnouncement broadcast = (BroadcastAnnouncement) signed.getAnnouncement();
        url = broadcast.getUrl();
        contentHash = broadcast.getContentHash();
      } else {
        ReplyAnnouncement reply = (ReplyAnnouncement) signed.getAnnouncement();
        url = reply.getUrl();
        contentHash = reply.getContentHash();
      }
      byte[] content = contentFetcher.fetch(url);
      if (content == null) {
        LOGGER.debug("No content found at {}", url);
        return false;
      }
      HashCode actual = config.getContentHashFunction().hashBytes(content);
      if (!actual.toString().equals(Identifiers.normalizeHex(contentHash))) {
        LOGGER.debug("Content at {} hashed to {} but the announcement claims {}", url, actual, contentHash);
        return false;
      }
    }
    return true;
  }
}
