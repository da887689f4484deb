package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

/** 既存ワークアイテムが見つかったときに適用する更新内容。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdoDuplicateTemplate(
    List<String> increment,
    Map<String, String> setState,
    Map<String, String> adoFields,
    String comment) {

  public AdoDuplicateTemplate {
    increment = ModelCollections.immutableList(increment);
    setState = ModelCollections.immutableMap(setState);
    adoFields = ModelCollections.immutableMap(adoFields);
  }

  public AdoDuplicateTemplate withTemplates(Map<String, String> adoFields, String comment) {
    return new AdoDuplicateTemplate(increment, setState, adoFields, comment);
  }
}
