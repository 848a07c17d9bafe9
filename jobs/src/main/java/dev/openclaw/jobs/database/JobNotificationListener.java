package dev.openclaw.jobs.database;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.execution.JobsLifecycleListener;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one pooled connection in {@code LISTEN} on {@link Constants#JOB_NOTIFY_CHANNEL} and runs
 * {@code onWake} whenever a job is inserted. {@code onWake} also runs each time the listener
 * (re)connects, since notifications sent while it was disconnected are lost.
 */
public class JobNotificationListener implements JobsLifecycleListener {

  private static final Logger logger = LoggerFactory.getLogger(JobNotificationListener.class);

  private static final int POLL_TIMEOUT_MS = 1000;

  private final DataSource dataSource;
  private final Runnable onWake;
  private final Duration reconnectDelay;

  private volatile boolean running = false;
  private volatile boolean listening = false;
  private Thread listenerThread;

  public JobNotificationListener(DataSource dataSource, Runnable onWake) {
    this(dataSource, onWake, Duration.ofSeconds(1));
  }

  JobNotificationListener(DataSource dataSource, Runnable onWake, Duration reconnectDelay) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    this.onWake = Objects.requireNonNull(onWake, "onWake must not be null");
    this.reconnectDelay = Objects.requireNonNull(reconnectDelay);
  }

  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    listenerThread = new Thread(this::listen, "JobNotificationListener");
    listenerThread.setDaemon(true);
    listenerThread.start();
    logger.info("Job notification listener started");
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    listenerThread.interrupt();
    try {
      listenerThread.join(5000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    listenerThread = null;
    logger.info("Job notification listener stopped");
  }

  /** True while a connection is in {@code LISTEN}. */
  public boolean isListening() {
    return listening;
  }

  @Override
  public void jobsLaunched() {
    start();
  }

  @Override
  public void jobsShutDown() {
    stop();
  }

  private void listen() {
    while (running) {
      try (Connection conn = dataSource.getConnection()) {
        conn.setAutoCommit(true);
        PGConnection pgConnection = conn.unwrap(PGConnection.class);
        try (Statement stmt = conn.createStatement()) {
          stmt.execute("LISTEN " + Constants.JOB_NOTIFY_CHANNEL);
        }
        listening = true;
        logger.debug("Listening on {}", Constants.JOB_NOTIFY_CHANNEL);
        wake();

        while (running) {
          PGNotification[] notifications = pgConnection.getNotifications(POLL_TIMEOUT_MS);
          if (notifications != null && notifications.length > 0) {
            if (logger.isDebugEnabled()) {
              for (var n : notifications) {
                logger.debug("Job notification on {}: {}", n.getName(), n.getParameter());
              }
            }
            wake();
          }
        }
        listening = false;
        // the connection goes back to the pool
        try (Statement stmt = conn.createStatement()) {
          stmt.execute("UNLISTEN *");
        }
      } catch (SQLException e) {
        listening = false;
        if (!running) {
          break;
        }
        logger.warn(
            "Job notification listener error, reconnecting in {} ms: {}",
            reconnectDelay.toMillis(),
            e.getMessage());
        try {
          Thread.sleep(reconnectDelay.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
      } finally {
        listening = false;
      }
    }
    logger.debug("Job notification listener thread exiting");
  }

  private void wake() {
    try {
      onWake.run();
    } catch (RuntimeException e) {
      logger.error("Job notification callback failed", e);
    }
  }
}
