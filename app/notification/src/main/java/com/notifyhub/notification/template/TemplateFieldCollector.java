package com.notifyhub.notification.template;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** extract 側の列挙補助。null のリスト/マップは要素なしとして扱う。同じ位置を 2 回登録した場合は不整合として扱う。 */
final class TemplateFieldCollector {

  private final List<TemplateField> fields = new ArrayList<>();
  private final Set<FieldLocator> seen = new HashSet<>();

  TemplateFieldCollector scalar(String path, String value) {
    add(FieldLocator.scalar(path), value);
    return this;
  }

  TemplateFieldCollector mapValues(String path, Map<String, String> values) {
    if (values == null) {
      return this;
    }
    for (Map.Entry<String, String> entry : values.entrySet()) {
      add(FieldLocator.mapEntry(path, entry.getKey()), entry.getValue());
    }
    return this;
  }

  TemplateFieldCollector listItems(String path, List<String> values) {
    if (values == null) {
      return this;
    }
    for (int i = 0; i < values.size(); i++) {
      add(FieldLocator.listItem(path, i), values.get(i));
    }
    return this;
  }

  List<TemplateField> fields() {
    return List.copyOf(fields);
  }

  private void add(FieldLocator locator, String value) {
    if (!seen.add(locator)) {
      throw new MalformedConfigException("template field declared twice: " + locator);
    }
    fields.add(new TemplateField(locator, value));
  }
}
