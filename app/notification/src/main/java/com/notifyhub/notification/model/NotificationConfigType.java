/*
 * どこで: Notification ドメインモデル
 * 何を: 通知設定のチャネル種別を表す列挙
 * なぜ: 種別ごとの分岐を switch 式で網羅させ、追加漏れをコンパイル時に検出するため
 */
package com.notifyhub.notification.model;

public enum NotificationConfigType {
  ADO,
  GITHUB_ISSUES,
  TEAMS
}
