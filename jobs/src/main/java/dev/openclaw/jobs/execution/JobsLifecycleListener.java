package dev.openclaw.jobs.execution;

/**
 * For registering callbacks that hear about {@code JobsRuntime.launch()} and {@code
 * JobsRuntime.shutdown()}.
 */
public interface JobsLifecycleListener {
  /** Called from within launch, after the store is migrated and handlers are registered */
  void jobsLaunched();

  /** Called from within shutdown, before the store is closed */
  void jobsShutDown();
}
