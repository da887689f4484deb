/*
 * どこで: Notification セキュリティ設定
 * 何を: 内部 API 認証フィルタと管理者認可をフィルタチェーンへ組み込む
 * なぜ: 管理 API はインスタンス管理者、その他は内部認証済みの呼び出しだけに限定するため
 */
package com.notifyhub.notification.config;

import com.notifyhub.notification.service.InstanceConfigOperations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

@Configuration
@EnableConfigurationProperties(InternalApiProperties.class)
public class NotificationSecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      InternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  AuthorizationManager<RequestAuthorizationContext> instanceAdminAuthorizationManager(
      InstanceConfigOperations instanceConfigOperations) {
    return new InstanceAdminAuthorizationManager(instanceConfigOperations);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      AuthorizationManager<RequestAuthorizationContext> instanceAdminAuthorizationManager)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .access(instanceAdminAuthorizationManager)
                    .anyRequest()
                    .hasRole("INTERNAL"));
    return http.build();
  }
}
