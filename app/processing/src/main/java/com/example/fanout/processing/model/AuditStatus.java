package com.example.fanout.processing.model;

public enum AuditStatus {
  SENT,
  FILTERED_PREFS,
  FAILED
}
