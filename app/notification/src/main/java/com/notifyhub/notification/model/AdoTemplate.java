/*
 * どこで: Notification ドメインモデル
 * 何を: Azure DevOps ワークアイテム起票用の通知設定
 * なぜ: project/type/comment などのテンプレート文字列と接続情報を一体で保存するため
 */
package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.net.URI;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdoTemplate(
    URI baseUrl,
    SecretData<String> authToken,
    String project,
    String type,
    List<String> uniqueFields,
    Map<String, String> adoFields,
    AdoDuplicateTemplate onDuplicate,
    String comment)
    implements NotificationConfig {

  public AdoTemplate {
    uniqueFields = ModelCollections.immutableList(uniqueFields);
    adoFields = ModelCollections.immutableMap(adoFields);
  }

  @Override
  public NotificationConfigType configType() {
    return NotificationConfigType.ADO;
  }

  @Override
  public AdoTemplate withRedactedSecrets() {
    return new AdoTemplate(
        baseUrl, SecretData.redacted(), project, type, uniqueFields, adoFields, onDuplicate,
        comment);
  }

  public AdoTemplate withTemplates(
      String project,
      String type,
      Map<String, String> adoFields,
      AdoDuplicateTemplate onDuplicate,
      String comment) {
    return new AdoTemplate(
        baseUrl, authToken, project, type, uniqueFields, adoFields, onDuplicate, comment);
  }
}
