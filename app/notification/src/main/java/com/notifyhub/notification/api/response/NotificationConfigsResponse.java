package com.notifyhub.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationConfigsResponse(List<NotificationConfigResponse> notificationConfigs) {

  public NotificationConfigsResponse {
    notificationConfigs = List.copyOf(notificationConfigs);
  }
}
