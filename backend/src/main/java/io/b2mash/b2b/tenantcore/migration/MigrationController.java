package io.b2mash.b2b.tenantcore.migration;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints for tenant migrations and schema patches. */
@RestController
@RequestMapping("/internal/migrations")
public class MigrationController {

  private static final Logger log = LoggerFactory.getLogger(MigrationController.class);

  private final MigrationOrchestrator migrationOrchestrator;
  private final SchemaPatchApplier schemaPatchApplier;
  private final MigrationSet tenantMigrationSet;

  public MigrationController(
      MigrationOrchestrator migrationOrchestrator,
      SchemaPatchApplier schemaPatchApplier,
      MigrationSet tenantMigrationSet) {
    this.migrationOrchestrator = migrationOrchestrator;
    this.schemaPatchApplier = schemaPatchApplier;
    this.tenantMigrationSet = tenantMigrationSet;
  }

  @PostMapping("/run")
  public ResponseEntity<BatchReport> runAll() {
    log.info("Operator requested tenant migration batch");
    return ResponseEntity.ok(migrationOrchestrator.runAll(tenantMigrationSet));
  }

  @PostMapping("/cancel")
  public ResponseEntity<CancelResponse> cancel() {
    return ResponseEntity.ok(new CancelResponse(migrationOrchestrator.cancelRunning()));
  }

  @PostMapping("/tenants/{tenantId}")
  public ResponseEntity<TenantMigrationResult> migrateTenant(@PathVariable UUID tenantId) {
    log.info("Operator requested migration of tenant {}", tenantId);
    return ResponseEntity.ok(migrationOrchestrator.migrateTenant(tenantId, tenantMigrationSet));
  }

  @GetMapping("/status")
  public ResponseEntity<MigrationStatus> status() {
    return ResponseEntity.ok(migrationOrchestrator.status(tenantMigrationSet));
  }

  @GetMapping("/patches")
  public ResponseEntity<List<PatchDescription>> listPatches() {
    return ResponseEntity.ok(
        schemaPatchApplier.registeredPatches().stream()
            .map(patch -> new PatchDescription(patch.id(), patch.description()))
            .toList());
  }

  @PostMapping("/patches")
  public ResponseEntity<PatchBatchReport> applyAllPatches() {
    log.info("Operator requested schema patch run");
    return ResponseEntity.ok(schemaPatchApplier.applyAll());
  }

  @PostMapping("/patches/{patchId}/tenants/{tenantId}")
  public ResponseEntity<PatchResult> applyPatch(
      @PathVariable String patchId, @PathVariable UUID tenantId) {
    log.info("Operator requested patch {} for tenant {}", patchId, tenantId);
    return ResponseEntity.ok(schemaPatchApplier.applyPatch(patchId, tenantId));
  }

  public record CancelResponse(int cancelledRuns) {}

  public record PatchDescription(String id, String description) {}
}
