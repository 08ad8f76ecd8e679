package com.example.fanout.common.event;

public enum TargetType {
  USER,
  POST,
  COMMENT,
  STORY,
  SYSTEM
}
