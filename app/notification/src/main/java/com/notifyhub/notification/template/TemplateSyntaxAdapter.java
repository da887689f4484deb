/*
 * どこで: テンプレート移行
 * 何を: 旧記法のタグを新記法({{ ... }})へ書き換える
 * なぜ: タグ以外の文字列をバイト単位で保ったまま、通知テンプレートを新エンジンへ移すため
 */
package com.notifyhub.notification.template;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class TemplateSyntaxAdapter {

  private static final Pattern AND_OPERATOR = Pattern.compile("\\band\\b");
  private static final Pattern OR_OPERATOR = Pattern.compile("\\bor\\b");
  // "is not" と "not in" は比較演算子の一部なので残す
  private static final Pattern NOT_OPERATOR = Pattern.compile("(?<!\\bis\\s)\\bnot\\b\\s*+(?!in\\b)");

  /**
   * 役割: 1 つのテンプレート文字列を変換する。
   *
   * <p>動作: タグに一致しない部分はそのまま残す。タグを含まない入力は同一インスタンスを返す。出力は旧記法のタグを含まないため、
   * 変換済みの文字列に再適用しても変わらない。例外は投げない。
   */
  public String adapt(String template) {
    if (template == null || template.isEmpty()) {
      return template;
    }
    final Matcher matcher = LegacyTemplateDetector.LEGACY_TAG.matcher(template);
    if (!matcher.find()) {
      return template;
    }
    final StringBuilder adapted = new StringBuilder(template.length() + 16);
    int literalStart = 0;
    do {
      adapted.append(template, literalStart, matcher.start());
      final boolean comment = "#".equals(matcher.group(1));
      adapted.append(rewriteTag(comment, matcher.group(2), matcher.group(3), matcher.group(4)));
      literalStart = matcher.end();
    } while (matcher.find());
    adapted.append(template, literalStart, template.length());
    return adapted.toString();
  }

  private String rewriteTag(boolean comment, String openTrim, String body, String closeTrim) {
    final String open = "{{" + openTrim;
    final String close = closeTrim + "}}";
    // 変換後の出力が旧記法として再検出されないよう、本体に残った区切り文字を崩す
    final String content = neutralizeLegacyDelimiters(body.strip());
    if (comment) {
      return rewriteComment(open, content, close);
    }
    final String statement = rewriteStatement(content);
    return statement.isEmpty() ? open + " " + close : open + " " + statement + " " + close;
  }

  // "#" は行末までのコメントなので、改行を含む本文は "## ... ##" の複数行コメントにする
  private String rewriteComment(String open, String content, String close) {
    if (content.isEmpty()) {
      return open + " # " + close;
    }
    if (content.indexOf('\n') >= 0 || content.indexOf('\r') >= 0) {
      return open + " ## " + content.replace("##", "# #") + " ## " + close;
    }
    return open + " # " + content + " " + close;
  }

  private static String neutralizeLegacyDelimiters(String content) {
    return content
        .replace("{%", "{ %")
        .replace("{#", "{ #")
        .replace("%}", "% }")
        .replace("#}", "# }");
  }

  private String rewriteStatement(String statement) {
    if (statement.isEmpty()) {
      return statement;
    }
    final String[] parts = statement.split("\\s+", 2);
    final String keyword = parts[0].toLowerCase(Locale.ROOT);
    final String rest = parts.length > 1 ? parts[1] : "";
    switch (keyword) {
      case "if":
        return "if " + rewriteExpression(rest);
      case "elif":
        return "else if " + rewriteExpression(rest);
      case "else":
        return "else";
      case "set":
        return rewriteExpression(rest);
      default:
        if (keyword.startsWith("end")) {
          return "end";
        }
        return statement;
    }
  }

  // 文字列リテラルの中身には触れず、キーワード演算子だけを記号へ置き換える
  private String rewriteExpression(String expression) {
    final StringBuilder rewritten = new StringBuilder(expression.length());
    int segmentStart = 0;
    int index = 0;
    while (index < expression.length()) {
      final char current = expression.charAt(index);
      if (current != '"' && current != '\'') {
        index++;
        continue;
      }
      rewritten.append(rewriteOperators(expression.substring(segmentStart, index)));
      final int literalEnd = findLiteralEnd(expression, index, current);
      rewritten.append(expression, index, literalEnd);
      index = literalEnd;
      segmentStart = literalEnd;
    }
    rewritten.append(rewriteOperators(expression.substring(segmentStart)));
    return rewritten.toString();
  }

  private int findLiteralEnd(String expression, int quoteIndex, char quote) {
    int index = quoteIndex + 1;
    while (index < expression.length()) {
      final char current = expression.charAt(index);
      if (current == '\\') {
        index += 2;
        continue;
      }
      if (current == quote) {
        return index + 1;
      }
      index++;
    }
    return expression.length();
  }

  private String rewriteOperators(String code) {
    if (code.isEmpty()) {
      return code;
    }
    String rewritten = AND_OPERATOR.matcher(code).replaceAll("&&");
    rewritten = OR_OPERATOR.matcher(rewritten).replaceAll("||");
    return NOT_OPERATOR.matcher(rewritten).replaceAll("!");
  }
}
