package org.dsnp.herald.columnfile;

import java.util.Arrays;

/**
 * Sections of a batch file in the order they are written. Sections with a negative id have a fixed position and
 * carry no id on disk.
 */
public enum BatchFileSection {
  HEADER(-1),
  SCHEMA(1),
  ROWGROUP(2),
  BLOOM_FILTER(3),
  FOOTER(4),
  TRAILER(-1);

  private final int sectionID;

  BatchFileSection(int i)
  {
    this.sectionID = i;
  }

  public static BatchFileSection fromID(int sectionType)
  {
    if (sectionType < 0)
      return null;
    return Arrays.stream(values()).filter(x -> x.sectionID == sectionType).findFirst().orElse(null);
  }

  public int getSectionID()
  {
    return sectionID;
  }
}
