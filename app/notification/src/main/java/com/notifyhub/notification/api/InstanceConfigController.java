/*
 * どこで: Notification 管理 API
 * 何を: インスタンス設定(管理者一覧)の参照/更新エンドポイントを公開する
 * なぜ: 管理者の追加/削除を etag 付きで安全に行えるようにするため
 */
package com.notifyhub.notification.api;

import com.notifyhub.notification.api.request.InstanceAdminsUpdateRequest;
import com.notifyhub.notification.api.response.InstanceConfigResponse;
import com.notifyhub.notification.service.InstanceConfigOperations;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/instance-config")
@RequiredArgsConstructor
public class InstanceConfigController {

  private final InstanceConfigOperations instanceConfigOperations;

  @GetMapping
  public ResponseEntity<InstanceConfigResponse> get() {
    // 管理者認可を通過した時点で設定は存在する
    return ResponseEntity.ok(
        InstanceConfigResponse.from(
            instanceConfigOperations
                .fetch()
                .orElseThrow(() -> new IllegalStateException("instance config missing"))));
  }

  @PutMapping("/admins")
  public ResponseEntity<InstanceConfigResponse> replaceAdmins(
      @Valid @RequestBody InstanceAdminsUpdateRequest request) {
    return ResponseEntity.ok(
        InstanceConfigResponse.from(
            instanceConfigOperations.replaceAdmins(request.admins(), request.etag())));
  }
}
