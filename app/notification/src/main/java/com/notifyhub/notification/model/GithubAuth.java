package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GithubAuth(String user, String personalAccessToken) {

  @Override
  public String toString() {
    return "GithubAuth[user=" + user + ", personalAccessToken=****]";
  }
}
