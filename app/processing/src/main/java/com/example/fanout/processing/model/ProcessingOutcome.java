package com.example.fanout.processing.model;

/** 1 イベントの処理結果。メトリクスの outcome タグにも使う。 */
public enum ProcessingOutcome {
  SENT,
  AGGREGATED_SENT,
  ABSORBED,
  FILTERED
}
