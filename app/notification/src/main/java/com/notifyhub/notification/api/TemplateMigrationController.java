/*
 * どこで: Notification 管理 API
 * 何を: 通知テンプレートの記法移行エンドポイントを公開する
 * なぜ: 旧記法のテンプレートを管理者操作で一括移行できるようにするため
 */
package com.notifyhub.notification.api;

import com.notifyhub.notification.api.request.TemplateMigrationRequest;
import com.notifyhub.notification.api.response.TemplateMigrationDryRunResponse;
import com.notifyhub.notification.api.response.TemplateMigrationResponse;
import com.notifyhub.notification.service.TemplateMigrationResult;
import com.notifyhub.notification.service.TemplateMigrationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/notifications")
@RequiredArgsConstructor
public class TemplateMigrationController {

  private final TemplateMigrationService templateMigrationService;

  @PostMapping("/template-migrations")
  public ResponseEntity<?> migrateTemplates(
      @RequestBody(required = false) TemplateMigrationRequest request) {
    final boolean dryRun = request != null && request.dryRunOrDefault();
    final TemplateMigrationResult result = templateMigrationService.migrate(dryRun);
    if (dryRun) {
      return ResponseEntity.ok(
          new TemplateMigrationDryRunResponse(result.notificationIdsToUpdate()));
    }
    return ResponseEntity.ok(
        new TemplateMigrationResponse(
            result.updatedNotificationIds(), result.failedNotificationIds()));
  }
}
