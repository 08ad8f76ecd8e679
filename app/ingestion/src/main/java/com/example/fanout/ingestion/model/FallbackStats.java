package com.example.fanout.ingestion.model;

/**
 * フォールバック保存分の件数。
 *
 * @param pending 未処理かつ再送回数が上限未満
 * @param failed 未処理かつ再送回数が上限に到達
 * @param processed 再送済み
 */
public record FallbackStats(long pending, long failed, long processed) {

  public static FallbackStats empty() {
    return new FallbackStats(0, 0, 0);
  }
}
