package org.dsnp.herald.announcement;

import org.dsnp.herald.Constants;

public class UnknownAnnouncementTypeException extends AnnouncementValidationException {
  private static final long serialVersionUID = 6212409812263398046L;
  private final Object dsnpType;

  public UnknownAnnouncementTypeException(Object dsnpType) {
    super(Constants.DSNP_TYPE, "unknown announcement type " + dsnpType);
    this.dsnpType = dsnpType;
  }

  public Object getDsnpType() {
    return dsnpType;
  }
}
