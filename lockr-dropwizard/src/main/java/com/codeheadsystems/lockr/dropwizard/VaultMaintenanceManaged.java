package com.codeheadsystems.lockr.dropwizard;

import com.codeheadsystems.lockr.server.VaultMaintenanceTask;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the {@link VaultMaintenanceTask} sweeper to the Dropwizard lifecycle.
 */
public class VaultMaintenanceManaged implements Managed {

  private final VaultMaintenanceTask task;

  public VaultMaintenanceManaged(VaultMaintenanceTask task) {
    this.task = task;
  }

  @Override
  public void start() {
    task.start();
  }

  @Override
  public void stop() {
    task.stop();
  }
}
