package com.notifyhub.notification.template;

import com.notifyhub.notification.model.TeamsTemplate;
import java.util.List;
import java.util.Map;

/** Teams は Webhook URL(秘密値)しか持たず、テンプレートフィールドはない。 */
final class TeamsTemplateFieldSet implements TemplateFieldSet<TeamsTemplate> {

  @Override
  public List<TemplateField> extract(TeamsTemplate config) {
    return List.of();
  }

  @Override
  public TeamsTemplate rebuild(TeamsTemplate config, Map<FieldLocator, String> updates) {
    new TemplateFieldUpdates(updates).verifyAllApplied();
    return config;
  }
}
