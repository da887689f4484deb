/*
 * どこで: Notification Repository 層
 * 何を: 通知設定と jsonb 文字列を相互変換する
 * なぜ: type タグ付きの多相 JSON を保存と読み出しで同じ規則に揃えるため
 */
package com.notifyhub.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.model.NotificationConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不要なため")
public class NotificationConfigJsonCodec {

  private final ObjectMapper objectMapper;

  public NotificationConfigJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String toJson(NotificationConfig config) {
    try {
      // notification_type タグは基底型で書いたときに付く
      return objectMapper.writerFor(NotificationConfig.class).writeValueAsString(config);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification config", ex);
    }
  }

  public NotificationConfig fromJson(String json) {
    final NotificationConfig config;
    try {
      config = objectMapper.readValue(json, NotificationConfig.class);
    } catch (JsonProcessingException ex) {
      throw new NotificationConfigDecodeException(
          "failed to deserialize notification config: " + ex.getOriginalMessage(), ex);
    }
    if (config == null) {
      throw new NotificationConfigDecodeException("notification config is null");
    }
    return config;
  }
}
