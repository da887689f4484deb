package com.notifyhub.notification.model;

public enum GithubIssueSearchMatch {
  TITLE,
  BODY
}
