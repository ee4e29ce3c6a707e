package dev.workflowcron.scheduler.database;

@FunctionalInterface
public interface ThrowingRunnable<E extends Throwable> {
  void execute() throws E;
}
