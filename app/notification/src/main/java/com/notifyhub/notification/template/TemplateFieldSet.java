package com.notifyhub.notification.template;

import com.notifyhub.notification.model.NotificationConfig;
import java.util.List;
import java.util.Map;

/**
 * 1 つの通知設定種別が持つテンプレートフィールドの一覧。
 *
 * <p>extract と rebuild は同じフィールドを同じ順で列挙すること。列挙は明示的に保守する(リフレクションによる自動検出はしない)。
 */
interface TemplateFieldSet<C extends NotificationConfig> {

  List<TemplateField> extract(C config);

  /** updates に含まれない値、およびテンプレート以外の属性はすべてそのまま引き継ぐ。 */
  C rebuild(C config, Map<FieldLocator, String> updates);
}
