package org.dsnp.herald;

public final class Constants {
  public final static String STORE_DELIMETER = "/";

  // Announcement wire field names
  public final static String DSNP_TYPE = "dsnpType";
  public final static String FROM_ID = "fromId";
  public final static String SIGNATURE = "signature";
  public final static String CHANGE_TYPE = "changeType";
  public final static String OBJECT_ID = "objectId";
  public final static String CREATED_AT = "createdAt";
  public final static String URL = "url";
  public final static String CONTENT_HASH = "contentHash";
  public final static String IN_REPLY_TO = "inReplyTo";
  public final static String EMOJI = "emoji";
  public final static String TARGET_ANNOUNCEMENT_TYPE = "targetAnnouncementType";
  public final static String TARGET_SIGNATURE = "targetSignature";

  // Batch file constants
  public final static int SECTION_ID_BYTE_LENGTH = 4;
  public final static int LENGTH_BYTE_LENGTH = 4;
  public final static int MAGIC_BYTE_LENGTH = 2;
  public final static int VERSION_BYTE_LENGTH = 4;
  public final static int FOOTER_OFFSET_BYTE_LENGTH = 8;

  public final static int HEADER_BYTE_LENGTH = MAGIC_BYTE_LENGTH + VERSION_BYTE_LENGTH;
  public final static int TRAILER_BYTE_LENGTH = FOOTER_OFFSET_BYTE_LENGTH + MAGIC_BYTE_LENGTH;
  // Section id plus compressed and uncompressed lengths
  public final static int METADATA_SECTION_PREAMBLE_LENGTH = SECTION_ID_BYTE_LENGTH + 2 * LENGTH_BYTE_LENGTH;

  // Version that is written and supported. If there is a change to the format, then update this value.
  public final static int VERSION = 0x0001;

  // Designates start and end of a batch file
  public final static short MAGIC_HEADER = (short) 0xD5B7;

  public final static int DEFAULT_ROW_GROUP_SIZE = 4096;
  public final static double DEFAULT_BLOOM_FILTER_FPP = 0.01d;
  public final static int ZSTD_LEVEL = 3;

  private Constants() {}
}
