package com.fieldops.dispatch.sync;

import com.fieldops.dispatch.common.Actors;
import com.fieldops.dispatch.domain.Entities.SyncQueueItemEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController @RequestMapping("/api/sync") @Validated
public class SyncController {
  private final SyncCoordinator coordinator;

  public SyncController(SyncCoordinator coordinator){this.coordinator=coordinator;}

  public record SyncBatchReq(@NotBlank String deviceId, @NotNull List<SyncItem> items) {}
  public record ResolveReq(@NotNull SyncCoordinator.Resolution resolution) {}

  @PostMapping("/queue")
  Map<String,Object> queue(@Valid @RequestBody SyncBatchReq req){
    List<SyncItemResult> results = coordinator.submit(req.deviceId(), Actors.current(), req.items());
    return Map.of("ok", true, "deviceId", req.deviceId(), "results", results);
  }

  @GetMapping("/review")
  List<SyncQueueItemEntity> review(){
    return coordinator.reviewQueue();
  }

  @PostMapping("/review/{id}/resolve")
  SyncItemResult resolve(@PathVariable Long id, @Valid @RequestBody ResolveReq req){
    return coordinator.resolve(id, req.resolution(), Actors.current());
  }

  @GetMapping("/abandoned")
  List<SyncQueueItemEntity> abandoned(){
    return coordinator.abandoned();
  }
}
