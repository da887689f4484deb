/*
 * どこで: テンプレート移行
 * 何を: 通知設定の種別ごとにテンプレートフィールドを抽出/再構築する
 * なぜ: 種別の追加時に switch 式の網羅性で移行漏れをコンパイルエラーにするため
 */
package com.notifyhub.notification.template;

import com.notifyhub.notification.model.AdoTemplate;
import com.notifyhub.notification.model.GithubIssuesTemplate;
import com.notifyhub.notification.model.NotificationConfig;
import com.notifyhub.notification.model.TeamsTemplate;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TemplateFieldEnumerator {

  private final AdoTemplateFieldSet adoFieldSet = new AdoTemplateFieldSet();
  private final GithubIssuesTemplateFieldSet githubIssuesFieldSet =
      new GithubIssuesTemplateFieldSet();
  private final TeamsTemplateFieldSet teamsFieldSet = new TeamsTemplateFieldSet();

  /**
   * 役割: 宣言済みのテンプレートフィールドを宣言順に列挙する。
   *
   * <p>動作: 各フィールドはちょうど 1 回ずつ現れる。テンプレートを持たない種別は空リストを返す。
   */
  public List<TemplateField> extract(NotificationConfig config) {
    requireConfig(config);
    return switch (config.configType()) {
      case ADO -> adoFieldSet.extract(cast(config, AdoTemplate.class));
      case GITHUB_ISSUES -> githubIssuesFieldSet.extract(cast(config, GithubIssuesTemplate.class));
      case TEAMS -> teamsFieldSet.extract(cast(config, TeamsTemplate.class));
    };
  }

  /**
   * 役割: 変換後の値を差し込んだ新しい設定を返す。
   *
   * <p>動作: 秘密値/URL/フラグ/リスト順/マップのキー集合は変えない。宣言されていない位置への更新は {@link
   * MalformedConfigException}。
   */
  public NotificationConfig rebuild(NotificationConfig config, Map<FieldLocator, String> updates) {
    requireConfig(config);
    return switch (config.configType()) {
      case ADO -> adoFieldSet.rebuild(cast(config, AdoTemplate.class), updates);
      case GITHUB_ISSUES ->
          githubIssuesFieldSet.rebuild(cast(config, GithubIssuesTemplate.class), updates);
      case TEAMS -> teamsFieldSet.rebuild(cast(config, TeamsTemplate.class), updates);
    };
  }

  private void requireConfig(NotificationConfig config) {
    if (config == null) {
      throw new MalformedConfigException("notification config is missing");
    }
  }

  private <C extends NotificationConfig> C cast(NotificationConfig config, Class<C> type) {
    if (!type.isInstance(config)) {
      throw new MalformedConfigException(
          "config type " + config.configType() + " does not match " + type.getSimpleName());
    }
    return type.cast(config);
  }
}
