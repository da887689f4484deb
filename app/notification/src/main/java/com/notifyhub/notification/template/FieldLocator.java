package com.notifyhub.notification.template;

import java.util.Objects;

/**
 * 通知設定の中の 1 つのテンプレート文字列を指す位置。
 *
 * <p>path はネストをドット区切りで表す(例: {@code on_duplicate.ado_fields})。マップ要素は key、リスト要素は index を持つ。
 */
public record FieldLocator(String path, String key, Integer index) {

  public FieldLocator {
    Objects.requireNonNull(path, "path");
    if (key != null && index != null) {
      throw new IllegalArgumentException("locator cannot have both key and index");
    }
  }

  public static FieldLocator scalar(String path) {
    return new FieldLocator(path, null, null);
  }

  public static FieldLocator mapEntry(String path, String key) {
    return new FieldLocator(path, Objects.requireNonNull(key, "key"), null);
  }

  public static FieldLocator listItem(String path, int index) {
    return new FieldLocator(path, null, index);
  }

  @Override
  public String toString() {
    if (key != null) {
      return path + "[" + key + "]";
    }
    if (index != null) {
      return path + "[" + index + "]";
    }
    return path;
  }
}
