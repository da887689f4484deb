package com.notifyhub.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.notification.model.InstanceConfig;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InstanceConfigResponse(
    String instanceName, List<UUID> admins, UUID etag, Instant updatedAt) {

  public InstanceConfigResponse {
    admins = List.copyOf(admins);
  }

  public static InstanceConfigResponse from(InstanceConfig config) {
    return new InstanceConfigResponse(
        config.instanceName(), config.admins(), config.etag(), config.updatedAt());
  }
}
