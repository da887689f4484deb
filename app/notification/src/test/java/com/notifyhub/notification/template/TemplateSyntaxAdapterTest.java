/*
 * どこで: テンプレート移行の単体テスト
 * 何を: 旧記法タグから新記法への書き換え規則を検証する
 * なぜ: タグ以外の文字列を変えずに、制御構文と演算子だけを置き換えることを保証するため
 */
package com.notifyhub.notification.template;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TemplateSyntaxAdapterTest {

  private final TemplateSyntaxAdapter adapter = new TemplateSyntaxAdapter();
  private final LegacyTemplateDetector detector = new LegacyTemplateDetector();

  @Test
  void rewritesIfBlockAndKeepsSurroundingText() {
    assertThat(adapter.adapt("{% if org %} blah {% endif %}"))
        .isEqualTo("{{ if org }} blah {{ end }}");
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "{% elif x %}|{{ else if x }}",
        "{% else %}|{{ else }}",
        "{% endfor %}|{{ end }}",
        "{% for item in items %}|{{ for item in items }}",
        "{% set name = 'a' %}|{{ name = 'a' }}",
        "{# note #}|{{ # note }}",
        "{%- if x -%}|{{- if x -}}",
        "{% if a and b or c %}|{{ if a && b || c }}",
        "{% if not a %}|{{ if !a }}",
        "{% if a is not none %}|{{ if a is not none }}",
        "{% if a not in b %}|{{ if a not in b }}",
        "{% %}|{{ }}"
      })
  void rewritesSingleTag(String legacy, String expected) {
    assertThat(adapter.adapt(legacy)).isEqualTo(expected);
  }

  @Test
  void leavesQuotedOperatorsUntouched() {
    assertThat(adapter.adapt("{% if name == \"cats and dogs\" or flag %}"))
        .isEqualTo("{{ if name == \"cats and dogs\" || flag }}");
  }

  @Test
  void returnsSameInstanceWhenNothingToRewrite() {
    final String plain = "{{ already.migrated }} text";

    assertThat(adapter.adapt(plain)).isSameAs(plain);
    assertThat(adapter.adapt("")).isEmpty();
    assertThat(adapter.adapt(null)).isNull();
  }

  @Test
  void rewritesMultilineTemplate() {
    final String legacy = "line1\n{% if x %}\n  {{ x }}\n{% endif %}\nline5";

    assertThat(adapter.adapt(legacy)).isEqualTo("line1\n{{ if x }}\n  {{ x }}\n{{ end }}\nline5");
  }

  @Test
  void commentedOutDirectiveIsNotLeftAsLegacyTag() {
    final String adapted = adapter.adapt("{# {% if org %} #} x");

    assertThat(adapted).isEqualTo("{{ # { % if org % } }} x");
    assertThat(detector.needsMigration(adapted)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{# {% if org %} #} x",
        "{# {# nested #} #}",
        "{# a\n{% endif %} #}b",
        "{% if x {# y %} #}",
        "{%} {% if x %}",
        "{% if a %}{# {%- set b = 1 -%} #}{% endif %}"
      })
  void adaptedOutputIsStableUnderSecondPass(String legacy) {
    final String once = adapter.adapt(legacy);

    assertThat(detector.needsMigration(once)).isFalse();
    assertThat(adapter.adapt(once)).isEqualTo(once);
  }

  @Test
  void multilineCommentUsesBlockCommentForm() {
    assertThat(adapter.adapt("{# line one\nline two #}hello"))
        .isEqualTo("{{ ## line one\nline two ## }}hello");
  }

  @Test
  void multilineCommentKeepsBodyInsideBlockComment() {
    assertThat(adapter.adapt("{#- first\r\n## second -#}"))
        .isEqualTo("{{- ## first\r\n# # second ## -}}");
  }
}
