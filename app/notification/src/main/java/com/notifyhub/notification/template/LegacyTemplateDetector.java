/*
 * どこで: テンプレート移行
 * 何を: 文字列に旧記法({% ... %} / {# ... #})のタグが含まれるかを判定する
 * なぜ: 移行済みや素のテキストを再変換しないための唯一の入口にするため
 */
package com.notifyhub.notification.template;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class LegacyTemplateDetector {

  // group1: 区切り文字(% か #), group2/4: 空白制御の '-', group3: タグ本体
  static final Pattern LEGACY_TAG = Pattern.compile("\\{([%#])(-?)(.*?)(-?)\\1\\}", Pattern.DOTALL);

  /**
   * 役割: 移行対象かどうかを返す。
   *
   * <p>動作: 閉じたタグを 1 つでも含めば true。null/空文字は常に false。リテラルとして偶然タグ形の文字列を含む場合も true になる。
   */
  public boolean needsMigration(String value) {
    if (value == null || value.isEmpty()) {
      return false;
    }
    return LEGACY_TAG.matcher(value).find();
  }
}
