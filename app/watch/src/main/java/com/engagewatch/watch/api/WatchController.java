/*
 * Where: Watch API
 * What: Tracking, subscription, status, audit and statistics endpoints
 * Why: The dashboard and operators drive the watcher through this surface only
 */
package com.engagewatch.watch.api;

import com.engagewatch.watch.service.WatchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class WatchController {

  private final WatchService watchService;

  @PutMapping("/resources/{resourceId}")
  public ResourceStatusResponse track(@PathVariable("resourceId") long resourceId) {
    return ResourceStatusResponse.from(watchService.trackResource(resourceId));
  }

  @GetMapping("/resources/{resourceId}")
  public ResourceStatusResponse status(@PathVariable("resourceId") long resourceId) {
    return ResourceStatusResponse.from(watchService.getResourceStatus(resourceId));
  }

  @GetMapping("/resources/{resourceId}/checks")
  public ResourceChecksResponse checks(
      @PathVariable("resourceId") long resourceId,
      @RequestParam(value = "limit", defaultValue = "20")
          @Min(value = 1, message = "limit must be between 1 and 100")
          @Max(value = 100, message = "limit must be between 1 and 100")
          int limit) {
    return new ResourceChecksResponse(
        resourceId,
        watchService.listResourceChecks(resourceId, limit).stream()
            .map(ResourceChecksResponse.Check::from)
            .toList());
  }

  @GetMapping("/stats/global")
  public StatsResponse.Global globalStats() {
    return StatsResponse.Global.from(watchService.getGlobalStats());
  }

  @GetMapping("/stats/resources/{resourceId}")
  public StatsResponse.Resource resourceStats(@PathVariable("resourceId") long resourceId) {
    return StatsResponse.Resource.from(watchService.getResourceStats(resourceId));
  }

  @PutMapping("/subscribers/{subscriberId}/subscriptions/{resourceId}")
  public SubscriptionResponse subscribe(
      @PathVariable("subscriberId") String subscriberId,
      @PathVariable("resourceId") long resourceId) {
    watchService.subscribe(subscriberId, resourceId);
    return new SubscriptionResponse(subscriberId, resourceId, true);
  }

  @DeleteMapping("/subscribers/{subscriberId}/subscriptions/{resourceId}")
  public ResponseEntity<Void> unsubscribe(
      @PathVariable("subscriberId") String subscriberId,
      @PathVariable("resourceId") long resourceId) {
    watchService.unsubscribe(subscriberId, resourceId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/subscribers/{subscriberId}/notifications")
  public NotificationLogResponse notifications(@PathVariable("subscriberId") String subscriberId) {
    return NotificationLogResponse.from(
        subscriberId, watchService.listNotificationLog(subscriberId));
  }

  @PostMapping("/delay-jobs/{jobId}/requeue")
  public ResponseEntity<Void> requeue(@PathVariable("jobId") UUID jobId) {
    watchService.requeueFailed(jobId);
    return ResponseEntity.accepted().build();
  }
}
