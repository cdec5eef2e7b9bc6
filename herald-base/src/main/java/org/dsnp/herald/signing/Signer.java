package org.dsnp.herald.signing;

/**
 * Produces and recovers signatures over canonical announcement bytes. Key management stays with the implementation.
 */
public interface Signer {
  /**
   * @param message The canonical serialization of an announcement.
   *
   * @return The signature as {@code 0x} prefixed hex.
   */
  String sign(byte[] message);

  /**
   * @param message The canonical serialization of an announcement.
   * @param signature The signature to recover from.
   *
   * @return The identity, for example an address, that produced the signature.
   */
  String recoverSigner(byte[] message, String signature);
}
