/*
 * どこで: テンプレート移行
 * 何を: 通知設定からのフィールド抽出/再構築に失敗したことを示す例外
 * なぜ: 1 件の設定不整合をバッチ全体の失敗にせず、その通知だけを失敗扱いにするため
 */
package com.notifyhub.notification.template;

public class MalformedConfigException extends RuntimeException {

  public MalformedConfigException(String message) {
    super(message);
  }

  public MalformedConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
