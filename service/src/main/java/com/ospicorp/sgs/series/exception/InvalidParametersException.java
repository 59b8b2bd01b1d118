package com.ospicorp.sgs.series.exception;

public class InvalidParametersException extends SgsException {
  public static final int INVALID_DATE = 1001;
  public static final int INVERTED_RANGE = 1002;
  public static final int INVALID_REFERENCE = 1003;
  public static final int INVALID_LAST_N = 1004;
  public static final int INVALID_SPAN = 1005;

  private static final String ERROR_DOCS_BASE = "https://developers.ospicorp.com/docs/sgs/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidParametersException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = ERROR_DOCS_BASE + errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
