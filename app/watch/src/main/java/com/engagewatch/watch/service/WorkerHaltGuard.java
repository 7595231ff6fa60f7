/*
 * Where: Watch service layer
 * What: Stops a worker after the store becomes unreachable and resumes it after a successful probe
 * Why: Polling or dispatching without the store would lose state transitions
 */
package com.engagewatch.watch.service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component("watchWorkers")
public class WorkerHaltGuard implements HealthIndicator {

  private static final Logger logger = LoggerFactory.getLogger(WorkerHaltGuard.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final WatchMetrics metrics;
  private final OperatorAlertService alerts;
  private final Set<String> halted = ConcurrentHashMap.newKeySet();
  private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

  public WorkerHaltGuard(
      NamedParameterJdbcTemplate jdbcTemplate,
      WatchMetrics metrics,
      OperatorAlertService alerts) {
    this.jdbcTemplate = jdbcTemplate;
    this.metrics = metrics;
    this.alerts = alerts;
  }

  /**
   * Runs one worker cycle. A store failure halts the worker; while halted, each cycle only probes
   * the store and the work resumes on the first cycle whose probe succeeds. Any other failure is
   * rethrown; once it repeats {@code failure-threshold} cycles in a row the operator is alerted.
   */
  public void run(String worker, Runnable cycle) {
    if (halted.contains(worker) && !probe(worker)) {
      return;
    }
    try {
      cycle.run();
      failuresOf(worker).set(0);
    } catch (DataAccessResourceFailureException ex) {
      if (halted.add(worker)) {
        metrics.updateHaltedWorkers(halted.size());
        alerts.alert("worker " + worker + " halted: store unavailable");
      }
      logger.error("worker halted because the store is unavailable worker={}", worker, ex);
    } catch (RuntimeException ex) {
      final AtomicInteger failures = failuresOf(worker);
      final int count = failures.incrementAndGet();
      logger.error("worker cycle failed worker={} consecutiveFailures={}", worker, count);
      if (count >= alerts.failureThreshold()) {
        failures.set(0);
        alerts.alert(
            "worker " + worker + " failed " + count + " cycles in a row: " + ex.getMessage());
      }
      throw ex;
    }
  }

  public boolean isHalted(String worker) {
    return halted.contains(worker);
  }

  @Override
  public Health health() {
    if (halted.isEmpty()) {
      return Health.up().build();
    }
    return Health.down().withDetails(Map.of("halted_workers", Set.copyOf(halted))).build();
  }

  private boolean probe(String worker) {
    try {
      jdbcTemplate.queryForObject("SELECT 1", new MapSqlParameterSource(), Integer.class);
    } catch (DataAccessException ex) {
      logger.warn("store probe failed; worker stays halted worker={}", worker);
      return false;
    }
    halted.remove(worker);
    metrics.updateHaltedWorkers(halted.size());
    logger.info("store probe succeeded; worker resumed worker={}", worker);
    return true;
  }

  private AtomicInteger failuresOf(String worker) {
    return consecutiveFailures.computeIfAbsent(worker, key -> new AtomicInteger());
  }
}
