/*
 * どこで: Processing の集約
 * 何を: 集約結果から本文/タイトルを組み立てる
 * なぜ: 「A さんと他 N 人が…」形式で 1 通にまとめるため
 */
package com.example.fanout.processing.service;

import com.example.fanout.common.event.NotificationType;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class AggregatedMessageFormatter {

  static final String UNKNOWN_ACTOR = "Someone";

  /** 種別ごとの本文。count は重複を除いたアクター数。 */
  public String message(NotificationType type, String firstName, int count) {
    String name = firstName == null || firstName.isBlank() ? UNKNOWN_ACTOR : firstName;
    int others = Math.max(count - 1, 0);
    return switch (type) {
      case LIKE -> withOthers(name, others, "liked your post");
      case COMMENT -> withOthers(name, others, "commented on your post");
      case COMMENT_REPLY -> withOthers(name, others, "replied to your comment");
      case FOLLOW -> withOthers(name, others, "started following you");
      case POST_SHARE -> withOthers(name, others, "shared your post");
      case STORY_VIEW -> withOthers(name, others, "viewed your story");
      case BELL_POST -> name + " posted a new update";
      case MENTION -> name + " mentioned you";
      case POST_UPDATED -> name + " updated a post";
      case OTP -> "Your OTP code";
      case PASSWORD_RESET -> "Password reset request";
      case SECURITY_ALERT -> "Security alert";
      case MARKETING -> "Marketing notification";
      case DIGEST -> "Daily digest";
    };
  }

  /** 例: "3 new likes" / "1 new follow"。 */
  public String title(NotificationType type, int count) {
    return count + " new " + type.name().toLowerCase(Locale.ROOT) + (count > 1 ? "s" : "");
  }

  private static String withOthers(String name, int others, String action) {
    if (others == 0) {
      return name + " " + action;
    }
    return name + " and " + others + " other" + (others > 1 ? "s" : "") + " " + action;
  }
}
