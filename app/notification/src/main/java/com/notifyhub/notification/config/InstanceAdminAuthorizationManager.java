/*
 * どこで: Notification セキュリティ
 * 何を: 呼び出し元がインスタンス設定の管理者一覧に含まれるかを判定する
 * なぜ: 移行などの管理操作をインスタンス管理者だけに限定するため
 */
package com.notifyhub.notification.config;

import com.notifyhub.notification.service.InstanceConfigOperations;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

public class InstanceAdminAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private static final Logger logger =
      LoggerFactory.getLogger(InstanceAdminAuthorizationManager.class);

  private final InstanceConfigOperations instanceConfigOperations;

  public InstanceAdminAuthorizationManager(InstanceConfigOperations instanceConfigOperations) {
    this.instanceConfigOperations = instanceConfigOperations;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
      return new AuthorizationDecision(false);
    }
    final UUID userId = parseUserId(auth.getName());
    if (userId == null) {
      return new AuthorizationDecision(false);
    }
    // 設定が無い/管理者が空の場合は誰も許可しない
    final boolean admin =
        instanceConfigOperations.fetch().map(config -> config.isAdmin(userId)).orElse(false);
    if (!admin) {
      logger.info(
          "admin request denied userId={} path={}", userId, context.getRequest().getRequestURI());
    }
    return new AuthorizationDecision(admin);
  }

  private UUID parseUserId(String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(name.trim());
    } catch (IllegalArgumentException ex) {
      logger.debug("admin request with non-uuid principal name={}", name);
      return null;
    }
  }
}
