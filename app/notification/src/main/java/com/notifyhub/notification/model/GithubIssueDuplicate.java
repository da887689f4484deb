package com.notifyhub.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GithubIssueDuplicate(List<String> labels, boolean reopen, String comment) {

  public GithubIssueDuplicate {
    labels = ModelCollections.immutableList(labels);
  }

  public GithubIssueDuplicate withTemplates(List<String> labels, String comment) {
    return new GithubIssueDuplicate(labels, reopen, comment);
  }
}
