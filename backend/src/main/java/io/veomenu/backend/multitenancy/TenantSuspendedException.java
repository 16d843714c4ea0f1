package io.veomenu.backend.multitenancy;

import io.veomenu.backend.instance.InstanceStatus;
import java.util.UUID;

public class TenantSuspendedException extends TenantAccessException {

  public TenantSuspendedException(UUID instanceId, InstanceStatus status) {
    super("instance " + instanceId + " is " + status);
  }
}
