/*
 * どこで: 通知設定 API のテスト
 * 何を: 登録/参照の応答と秘密値の伏せ字、エラー応答を検証する
 * なぜ: API 応答から認証トークンや Webhook URL が漏れないことを保証するため
 */
package com.notifyhub.notification.api;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.notifyhub.notification.NotificationConfigFixtures;
import com.notifyhub.notification.model.NotificationConfig;
import com.notifyhub.notification.model.NotificationConfigRecord;
import com.notifyhub.notification.service.NotificationConfigService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationConfigController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationConfigControllerTest {

  private static final String ADO_BODY =
      """
      {
        "container": "container-a",
        "config": {
          "notification_type": "ado",
          "base_url": "https://dev.azure.com/example",
          "auth_token": {"value": "ado-secret-token"},
          "project": "{% if org %} blah {% endif %}",
          "type": "Bug",
          "unique_fields": ["System.Title"],
          "ado_fields": {"System.Title": "{{ report.task_id }}"}
        }
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationConfigService notificationConfigService;

  @Test
  void createReturnsRedactedRecord() throws Exception {
    when(notificationConfigService.create(eq("container-a"), any(NotificationConfig.class)))
        .thenAnswer(
            invocation ->
                NotificationConfigFixtures.record(invocation.getArgument(1, NotificationConfig.class)));

    mockMvc
        .perform(post("/notifications").contentType(MediaType.APPLICATION_JSON).content(ADO_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.config.notification_type").value("ado"))
        .andExpect(jsonPath("$.config.project").value("{% if org %} blah {% endif %}"))
        .andExpect(jsonPath("$.config.ado_fields['System.Title']").value("{{ report.task_id }}"))
        .andExpect(jsonPath("$.config.auth_token.value").value(nullValue()))
        .andExpect(jsonPath("$.notification_id").isNotEmpty())
        .andExpect(jsonPath("$.etag").isNotEmpty());
  }

  @Test
  void createRejectsMissingContainer() throws Exception {
    mockMvc
        .perform(
            post("/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"config\":{\"notification_type\":\"teams\",\"url\":{\"value\":\"u\"}}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void createRejectsUnknownNotificationType() throws Exception {
    mockMvc
        .perform(
            post("/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"container\":\"c\",\"config\":{\"notification_type\":\"email\"}}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void getUnknownIsNotFound() throws Exception {
    final UUID missing = UUID.randomUUID();
    when(notificationConfigService.get(missing))
        .thenThrow(new NotificationConfigNotFoundException(missing));

    mockMvc
        .perform(get("/notifications/" + missing))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void listByContainerRedactsTeamsWebhook() throws Exception {
    final NotificationConfigRecord teams =
        NotificationConfigFixtures.record(NotificationConfigFixtures.teams());
    when(notificationConfigService.listByContainer("container-a")).thenReturn(List.of(teams));

    mockMvc
        .perform(get("/notifications").param("container", "container-a"))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$.notification_configs[0].notification_id")
                .value(teams.notificationId().toString()))
        .andExpect(jsonPath("$.notification_configs[0].config.notification_type").value("teams"))
        .andExpect(jsonPath("$.notification_configs[0].config.url.value").value(nullValue()));
  }

  @Test
  void listRequiresContainer() throws Exception {
    mockMvc
        .perform(get("/notifications"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("container is required"));
  }
}
