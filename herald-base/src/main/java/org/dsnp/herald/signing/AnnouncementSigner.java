package org.dsnp.herald.signing;

import java.util.Objects;
import org.dsnp.herald.announcement.Announcement;
import org.dsnp.herald.announcement.AnnouncementSerializer;
import org.dsnp.herald.announcement.SignedAnnouncement;

public final class AnnouncementSigner {

  /**
   * Signs the canonical serialization of an announcement.
   *
   * @param announcement The announcement to sign.
   * @param signer The signer that holds the key.
   *
   * @return The announcement paired with its signature.
   */
  public static SignedAnnouncement sign(Announcement announcement, Signer signer) {
    Objects.requireNonNull(announcement, "The announcement cannot be null");
    Objects.requireNonNull(signer, "The signer cannot be null");
    String signature = signer.sign(AnnouncementSerializer.serializeToBytes(announcement));
    if (signature == null)
      throw new IllegalStateException("The signer returned no signature for " + announcement);
    return new SignedAnnouncement(announcement, signature);
  }

  /**
   * @return The identity that produced the signature of the given announcement.
   */
  public static String recoverSigner(SignedAnnouncement signedAnnouncement, Signer signer) {
    Objects.requireNonNull(signedAnnouncement, "The signed announcement cannot be null");
    Objects.requireNonNull(signer, "The signer cannot be null");
    byte[] message = AnnouncementSerializer.serializeToBytes(signedAnnouncement.getAnnouncement());
    return signer.recoverSigner(message, signedAnnouncement.getSignature());
  }

  private AnnouncementSigner() {}
}
