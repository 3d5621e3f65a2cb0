package com.delta.archivescraper.archive.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_422_UNPROCESSABLE = "HTTP_422_UNPROCESSABLE";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String MALFORMED_RESPONSE = "MALFORMED_RESPONSE";
  public static final String INVALID_REQUEST = "INVALID_REQUEST";
  public static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";
  public static final String STREAM_FAILED = "STREAM_FAILED";
  public static final String WRITE_FAILED = "WRITE_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(int status) {
    if (status <= 0) {
      return UNKNOWN;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 422) {
      return HTTP_422_UNPROCESSABLE;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("interrupted")) {
      return INTERRUPTED;
    }
    if (code.equals("malformed_body") || code.equals("missing_rate_limit")) {
      return MALFORMED_RESPONSE;
    }
    if (code.contains("io_error") || code.contains("http_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  /** The archive occasionally answers 422 for valid queries; a retry usually succeeds. */
  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, IO_ERROR, DNS_FAILURE, TLS_FAILURE, HTTP_422_UNPROCESSABLE, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }
}
