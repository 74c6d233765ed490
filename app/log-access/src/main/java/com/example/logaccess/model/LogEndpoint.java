package com.example.logaccess.model;

/** Operations recorded in the audit log, with the label written for each. */
public enum LogEndpoint {
  LIST_LOGS("List Logs", "list"),
  READ_LOG("Read Log", "read"),
  DOWNLOAD_LOG("Download Log", "download");

  private final String label;
  private final String metricTag;

  LogEndpoint(String label, String metricTag) {
    this.label = label;
    this.metricTag = metricTag;
  }

  public String label() {
    return label;
  }

  public String metricTag() {
    return metricTag;
  }
}
