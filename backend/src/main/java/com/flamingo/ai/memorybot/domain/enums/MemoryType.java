package com.flamingo.ai.memorybot.domain.enums;

/** Kind of content a memory was captured from. */
public enum MemoryType {
  TEXT,
  IMAGE,
  AUDIO,
  VIDEO,
  MIXED
}
