package com.notifyhub.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
    MDC.clear();
  }

  @Test
  void putsRequestKeysAndRemovesThemAfterCompletion() {
    SecurityContextHolder.getContext()
        .setAuthentication(new TestingAuthenticationToken("user-1", "N/A", "ROLE_INTERNAL"));
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/admin/notifications/template-migrations");
    request.addHeader("X-Request-Id", "req-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/admin/notifications/template-migrations");
    assertThat(MDC.get("user_id")).isEqualTo("user-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/notifications");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("user_id")).isNull();
  }
}
