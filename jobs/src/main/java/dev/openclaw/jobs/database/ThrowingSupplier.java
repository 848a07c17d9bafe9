package dev.openclaw.jobs.database;

@FunctionalInterface
public interface ThrowingSupplier<T, E extends Throwable> {
  T execute() throws E;
}
