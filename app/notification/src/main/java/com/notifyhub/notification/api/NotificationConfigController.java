/*
 * どこで: Notification API
 * 何を: 通知設定の登録/参照エンドポイントを公開する
 * なぜ: 移行対象となる設定を登録し、移行結果を確認できるようにするため
 */
package com.notifyhub.notification.api;

import com.notifyhub.notification.api.request.CreateNotificationConfigRequest;
import com.notifyhub.notification.api.response.NotificationConfigResponse;
import com.notifyhub.notification.api.response.NotificationConfigsResponse;
import com.notifyhub.notification.service.NotificationConfigService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationConfigController {

  private final NotificationConfigService notificationConfigService;

  @PostMapping
  public ResponseEntity<NotificationConfigResponse> create(
      @Valid @RequestBody CreateNotificationConfigRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            NotificationConfigResponse.from(
                notificationConfigService.create(request.container(), request.config())));
  }

  @GetMapping("/{notificationId}")
  public ResponseEntity<NotificationConfigResponse> get(
      @PathVariable("notificationId") UUID notificationId) {
    return ResponseEntity.ok(
        NotificationConfigResponse.from(notificationConfigService.get(notificationId)));
  }

  @GetMapping
  public ResponseEntity<NotificationConfigsResponse> listByContainer(
      @RequestParam("container") String container) {
    return ResponseEntity.ok(
        new NotificationConfigsResponse(
            notificationConfigService.listByContainer(container).stream()
                .map(NotificationConfigResponse::from)
                .toList()));
  }
}
