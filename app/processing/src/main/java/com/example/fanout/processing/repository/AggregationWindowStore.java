/*
 * どこで: Processing の集約ストア境界
 * 何を: ウィンドウへのアクター追加、原子的フラッシュ、ウィンドウ列挙を定義する
 * なぜ: 集約判定ロジックを Redis 実装から切り離してテストできるようにするため
 */
package com.example.fanout.processing.repository;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.processing.model.AggregationKey;
import com.example.fanout.processing.model.WindowSnapshot;
import java.util.List;
import java.util.Optional;

public interface AggregationWindowStore {

  /**
   * アクターをウィンドウに追加し、重複を除いたアクター数を返す。
   *
   * <p>同じ actorId の再追加は到着順を変えない。初回追加時はイベントをウィンドウのメタ情報として保存する。
   * actorAvatars は actorNames と同じ添字で並び、アバターの無いアクターは空文字になる。
   */
  long addActor(AggregationKey key, NotificationEvent event);

  /** ウィンドウを読み出して削除する。既に空/削除済みなら empty。 */
  Optional<WindowSnapshot> flush(String windowKey);

  /**
   * フラッシュ済みの中身をウィンドウへ戻す。
   *
   * <p>戻したアクターはその間に追加されたアクターより前に並び、先頭イベントも戻した側のものになる。
   */
  void restore(String windowKey, WindowSnapshot snapshot);

  List<String> findWindowKeys(long windowId);
}
