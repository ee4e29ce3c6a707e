package dev.workflowcron.scheduler.reconcile;

import java.util.UUID;

/** Serializes reconciliation passes of the same project. */
public interface ProjectLock {

  /** Blocks until the project's lock is held; closing the handle releases it. */
  Held acquire(UUID projectId);

  interface Held extends AutoCloseable {
    @Override
    void close();
  }
}
