package com.flamingo.ai.memorybot.service.media;

import java.util.Map;

/**
 * Aggregate view of the blob store.
 *
 * @param totalReferences upload events recorded
 * @param uniqueBlobs distinct payloads on disk
 * @param totalLogicalSize bytes the uploads would occupy without deduplication
 * @param totalPhysicalSize bytes actually held on disk
 * @param byType reference counts per sniffed content type
 * @param dedupRate share of uploads that reused an existing blob, 0 when there are none
 */
public record MediaStats(
    long totalReferences,
    long uniqueBlobs,
    long totalLogicalSize,
    long totalPhysicalSize,
    Map<String, Long> byType,
    double dedupRate) {

  static double dedupRate(long totalReferences, long uniqueBlobs) {
    if (totalReferences == 0) {
      return 0.0;
    }
    return (double) (totalReferences - uniqueBlobs) / totalReferences;
  }
}
