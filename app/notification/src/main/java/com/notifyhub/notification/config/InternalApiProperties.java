/*
 * どこで: Notification アプリ設定バインド
 * 何を: 内部 API 認証のヘッダ名とトークンを保持する
 * なぜ: ゲートウェイから転送されたリクエストだけを受け付けるため
 */
package com.notifyhub.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.internal-api")
public record InternalApiProperties(String headerName, String token, String userIdHeaderName) {

  public InternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
  }
}
