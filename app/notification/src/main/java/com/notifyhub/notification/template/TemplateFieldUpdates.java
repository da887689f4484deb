package com.notifyhub.notification.template;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * rebuild 側の適用補助。
 *
 * <p>マップはキー集合と順序を、リストは件数と順序を保ったまま値だけを差し替える。どのフィールドにも当たらなかった更新は {@link
 * #verifyAllApplied()} で検出する。
 */
final class TemplateFieldUpdates {

  private final Map<FieldLocator, String> updates;
  private final Set<FieldLocator> applied = new HashSet<>();

  TemplateFieldUpdates(Map<FieldLocator, String> updates) {
    this.updates = updates;
  }

  String scalar(String path, String current) {
    return valueFor(FieldLocator.scalar(path), current);
  }

  Map<String, String> mapValues(String path, Map<String, String> current) {
    if (current == null || !hasUpdatesFor(path)) {
      return current;
    }
    final Map<String, String> rebuilt = new LinkedHashMap<>(current.size());
    for (Map.Entry<String, String> entry : current.entrySet()) {
      rebuilt.put(
          entry.getKey(), valueFor(FieldLocator.mapEntry(path, entry.getKey()), entry.getValue()));
    }
    return rebuilt;
  }

  List<String> listItems(String path, List<String> current) {
    if (current == null || !hasUpdatesFor(path)) {
      return current;
    }
    final List<String> rebuilt = new ArrayList<>(current.size());
    for (int i = 0; i < current.size(); i++) {
      rebuilt.add(valueFor(FieldLocator.listItem(path, i), current.get(i)));
    }
    return rebuilt;
  }

  void verifyAllApplied() {
    if (applied.size() == updates.size()) {
      return;
    }
    final String unknown =
        updates.keySet().stream()
            .filter(locator -> !applied.contains(locator))
            .map(FieldLocator::toString)
            .sorted()
            .collect(Collectors.joining(", "));
    throw new MalformedConfigException("updates do not match any template field: " + unknown);
  }

  private boolean hasUpdatesFor(String path) {
    return updates.keySet().stream().anyMatch(locator -> locator.path().equals(path));
  }

  private String valueFor(FieldLocator locator, String current) {
    if (!updates.containsKey(locator)) {
      return current;
    }
    applied.add(locator);
    return updates.get(locator);
  }
}
