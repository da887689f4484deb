package com.notifyhub.notification.template;

import com.notifyhub.notification.model.AdoDuplicateTemplate;
import com.notifyhub.notification.model.AdoTemplate;
import java.util.List;
import java.util.Map;

/** ADO: project/type/comment, ado_fields の各値、on_duplicate の comment と ado_fields の各値。 */
final class AdoTemplateFieldSet implements TemplateFieldSet<AdoTemplate> {

  static final String PROJECT = "project";
  static final String TYPE = "type";
  static final String COMMENT = "comment";
  static final String ADO_FIELDS = "ado_fields";
  static final String ON_DUPLICATE_COMMENT = "on_duplicate.comment";
  static final String ON_DUPLICATE_ADO_FIELDS = "on_duplicate.ado_fields";

  @Override
  public List<TemplateField> extract(AdoTemplate config) {
    final TemplateFieldCollector collector =
        new TemplateFieldCollector()
            .scalar(PROJECT, config.project())
            .scalar(TYPE, config.type())
            .scalar(COMMENT, config.comment())
            .mapValues(ADO_FIELDS, config.adoFields());
    final AdoDuplicateTemplate onDuplicate = config.onDuplicate();
    if (onDuplicate != null) {
      collector
          .scalar(ON_DUPLICATE_COMMENT, onDuplicate.comment())
          .mapValues(ON_DUPLICATE_ADO_FIELDS, onDuplicate.adoFields());
    }
    return collector.fields();
  }

  @Override
  public AdoTemplate rebuild(AdoTemplate config, Map<FieldLocator, String> updates) {
    final TemplateFieldUpdates fieldUpdates = new TemplateFieldUpdates(updates);
    final AdoDuplicateTemplate onDuplicate = config.onDuplicate();
    final AdoTemplate rebuilt =
        config.withTemplates(
            fieldUpdates.scalar(PROJECT, config.project()),
            fieldUpdates.scalar(TYPE, config.type()),
            fieldUpdates.mapValues(ADO_FIELDS, config.adoFields()),
            onDuplicate == null
                ? null
                : onDuplicate.withTemplates(
                    fieldUpdates.mapValues(ON_DUPLICATE_ADO_FIELDS, onDuplicate.adoFields()),
                    fieldUpdates.scalar(ON_DUPLICATE_COMMENT, onDuplicate.comment())),
            fieldUpdates.scalar(COMMENT, config.comment()));
    fieldUpdates.verifyAllApplied();
    return rebuilt;
  }
}
