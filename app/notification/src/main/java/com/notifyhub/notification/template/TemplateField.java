package com.notifyhub.notification.template;

/** 抽出されたテンプレート文字列と、その位置。value は null になりうる。 */
public record TemplateField(FieldLocator locator, String value) {}
