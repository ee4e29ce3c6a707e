package dev.workflowcron.scheduler.database;

@FunctionalInterface
public interface ThrowingSupplier<T, E extends Throwable> {
  T execute() throws E;
}
