package com.example.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
