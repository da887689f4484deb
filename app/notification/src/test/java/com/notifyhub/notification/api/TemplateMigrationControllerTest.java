/*
 * どこで: テンプレート移行 API のテスト
 * 何を: dry-run/commit の応答形状と入力エラーを検証する
 * なぜ: 運用手順が依存する JSON のキー名と省略時の既定動作を固定するため
 */
package com.notifyhub.notification.api;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.notifyhub.notification.service.TemplateMigrationResult;
import com.notifyhub.notification.service.TemplateMigrationService;
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

@WebMvcTest(TemplateMigrationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class TemplateMigrationControllerTest {

  private static final String PATH = "/admin/notifications/template-migrations";
  private static final UUID FIRST = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final UUID SECOND = UUID.fromString("22222222-2222-2222-2222-222222222222");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TemplateMigrationService templateMigrationService;

  @Test
  void dryRunReturnsCandidateIds() throws Exception {
    when(templateMigrationService.migrate(true))
        .thenReturn(
            new TemplateMigrationResult(true, List.of(FIRST), List.of(), List.of(), List.of(SECOND)));

    mockMvc
        .perform(post(PATH).contentType(MediaType.APPLICATION_JSON).content("{\"dry_run\":true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.notification_ids_to_update[0]").value(FIRST.toString()))
        .andExpect(jsonPath("$.notification_ids_to_update.length()").value(1))
        .andExpect(jsonPath("$.updated_notification_ids").doesNotExist());
  }

  @Test
  void commitReturnsUpdatedAndFailedIds() throws Exception {
    when(templateMigrationService.migrate(false))
        .thenReturn(
            new TemplateMigrationResult(false, List.of(), List.of(FIRST), List.of(SECOND), List.of()));

    mockMvc
        .perform(post(PATH).contentType(MediaType.APPLICATION_JSON).content("{\"dry_run\":false}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated_notification_ids[0]").value(FIRST.toString()))
        .andExpect(jsonPath("$.failed_notification_ids[0]").value(SECOND.toString()))
        .andExpect(jsonPath("$.notification_ids_to_update").doesNotExist());
  }

  @Test
  void missingBodyDefaultsToCommit() throws Exception {
    when(templateMigrationService.migrate(false))
        .thenReturn(new TemplateMigrationResult(false, List.of(), List.of(), List.of(), List.of()));

    mockMvc
        .perform(post(PATH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated_notification_ids").isEmpty())
        .andExpect(jsonPath("$.failed_notification_ids").isEmpty());

    verify(templateMigrationService).migrate(false);
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(post(PATH).contentType(MediaType.APPLICATION_JSON).content("{\"dry_run\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("request body is invalid"));

    verify(templateMigrationService, never()).migrate(anyBoolean());
  }
}
