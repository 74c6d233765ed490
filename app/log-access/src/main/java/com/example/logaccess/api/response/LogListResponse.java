package com.example.logaccess.api.response;

import java.util.List;

public record LogListResponse(List<String> logs) {

  public LogListResponse {
    logs = List.copyOf(logs);
  }
}
