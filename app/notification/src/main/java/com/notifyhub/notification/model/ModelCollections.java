/*
 * どこで: Notification ドメインモデル
 * 何を: レコードが保持するリスト/マップを不変化する補助
 * なぜ: 並び順とキー集合を保ち、保存時の null と空を区別したまま読み書きするため
 */
package com.notifyhub.notification.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ModelCollections {
  private ModelCollections() {}

  // List.copyOf は null 要素を拒否するため、要素はそのまま写す
  static <T> List<T> immutableList(List<T> source) {
    if (source == null) {
      return null;
    }
    if (source.isEmpty()) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(source));
  }

  // Map.copyOf は挿入順を保証しないため LinkedHashMap で包む
  static <K, V> Map<K, V> immutableMap(Map<K, V> source) {
    if (source == null) {
      return null;
    }
    if (source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
