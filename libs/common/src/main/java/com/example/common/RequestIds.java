package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class RequestIds {

  private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** Keeps a caller supplied id only when it is safe to echo into log lines. */
  public static String resolve(String candidate) {
    if (candidate != null && ACCEPTED.matcher(candidate).matches()) {
      return candidate;
    }
    return newRequestId();
  }
}
