package com.dramacollector.collect.util;

import com.dramacollector.collect.model.SourceFetchResult;
import com.dramacollector.collect.source.SourceException;
import com.dramacollector.collect.source.SourceRejectedException;
import com.dramacollector.collect.source.SourceUnavailableException;

import java.util.Locale;

public final class SourceFailureClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNKNOWN = "UNKNOWN";

  private SourceFailureClassifier() {}

  public static String reasonCode(SourceFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null && !result.errorCode().isBlank()) {
      String code = result.errorCode().toLowerCase(Locale.ROOT);
      if (code.contains("timeout")) {
        return TIMEOUT;
      }
      if (code.contains("invalid_url")) {
        return INVALID_URL;
      }
      if (code.contains("io_error")) {
        return IO_ERROR;
      }
      return UNKNOWN;
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(int status) {
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
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

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, IO_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }

  /**
   * Maps a failed fetch onto the source failure taxonomy: transient failures become
   * {@link SourceUnavailableException}, everything else {@link SourceRejectedException}.
   */
  public static SourceException toException(String source, SourceFetchResult result) {
    String reason = reasonCode(result);
    String detail = describe(result);
    String message = reason.toLowerCase(Locale.ROOT) + ": " + detail;
    if (isRetryable(reason)) {
      return new SourceUnavailableException(source, message);
    }
    return new SourceRejectedException(source, message);
  }

  private static String describe(SourceFetchResult result) {
    if (result == null) {
      return "no response";
    }
    if (result.errorMessage() != null && !result.errorMessage().isBlank()) {
      return result.errorMessage();
    }
    return "http " + result.statusCode() + " from " + result.requestedUrl();
  }
}
