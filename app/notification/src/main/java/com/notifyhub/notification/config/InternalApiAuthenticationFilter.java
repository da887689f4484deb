/*
 * どこで: Notification セキュリティ
 * 何を: 内部トークンと転送ユーザー ID から認証情報を組み立てる
 * なぜ: 管理 API の認可判定で呼び出し元ユーザーを識別するため
 */
package com.notifyhub.notification.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";

  private final InternalApiProperties properties;

  public InternalApiAuthenticationFilter(InternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || uri.startsWith("/actuator/") || "/error".equals(uri);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      logger.debug("internal authentication not established for path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      logger.warn(
          "internal request rejected: missing required header {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            forwardedUserId.trim(), "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    logger.debug(
        "internal authentication established for path={} userId={}",
        request.getRequestURI(),
        authentication.getName());
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }
}
