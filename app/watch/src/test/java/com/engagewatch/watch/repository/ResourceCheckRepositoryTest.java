/*
 * Where: ResourceCheckRepository integration tests
 * What: Check history aggregates used by the statistics endpoints
 * Why: Success rate and response time must only count what the poller actually recorded
 */
package com.engagewatch.watch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.engagewatch.watch.AbstractPostgresContainerTest;
import com.engagewatch.watch.model.CheckSummary;
import com.engagewatch.watch.model.ResourceCheckRecord;
import com.engagewatch.watch.model.ResourceStatus;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ResourceCheckRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-10-19T09:00:00Z");

  @Autowired private ResourceCheckRepository resourceCheckRepository;

  @Autowired private ResourceRepository resourceRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    TableCleaner.deleteAll(jdbcTemplate);
    resourceRepository.insertIfAbsent(1001, BASE_TIME);
    resourceRepository.insertIfAbsent(1002, BASE_TIME);
  }

  @Test
  void summaryAveragesSuccessfulChecksOnly() {
    resourceCheckRepository.insert(check(1001, BASE_TIME, 100, true));
    resourceCheckRepository.insert(check(1001, BASE_TIME.plusSeconds(5), 300, true));
    resourceCheckRepository.insert(check(1001, BASE_TIME.plusSeconds(10), 10_000, false));
    resourceCheckRepository.insert(check(1002, BASE_TIME.plusSeconds(5), 50, true));

    final CheckSummary single = resourceCheckRepository.summarize(1001);
    final CheckSummary all = resourceCheckRepository.summarizeAll();

    assertThat(single.totalChecks()).isEqualTo(3);
    assertThat(single.successfulChecks()).isEqualTo(2);
    assertThat(single.avgResponseTimeMs()).isEqualTo(200.0d);
    assertThat(all.totalChecks()).isEqualTo(4);
    assertThat(all.successfulChecks()).isEqualTo(3);
    assertThat(resourceCheckRepository.countSince(BASE_TIME.plusSeconds(5))).isEqualTo(3);
  }

  @Test
  void summaryOfUncheckedResourceIsEmpty() {
    assertThat(resourceCheckRepository.summarize(1002)).isEqualTo(CheckSummary.empty());
  }

  private static ResourceCheckRecord check(
      long resourceId, Instant checkedAt, long responseTimeMs, boolean success) {
    return new ResourceCheckRecord(
        UUID.randomUUID(),
        resourceId,
        checkedAt,
        ResourceStatus.UNOPENED,
        success ? ResourceStatus.UNOPENED : null,
        responseTimeMs,
        success,
        success ? null : "TIMEOUT");
  }
}
