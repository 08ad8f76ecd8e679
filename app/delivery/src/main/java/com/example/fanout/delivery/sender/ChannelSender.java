/*
 * どこで: Delivery 送信層
 * 何を: チャネルごとの外部送信を抽象化するインターフェース
 * なぜ: 実プロバイダ/テスト差し替えを容易にするため
 */
package com.example.fanout.delivery.sender;

import com.example.fanout.common.event.DeliveryChannel;
import com.example.fanout.common.event.NotificationEvent;

public interface ChannelSender {

  /**
   * 1 件を 1 回だけ送信する。再送は呼び出し側が行う。
   *
   * @throws com.example.fanout.common.retry.DeliveryFailureException プロバイダが失敗を返した場合
   */
  void send(DeliveryChannel channel, NotificationEvent event);
}
