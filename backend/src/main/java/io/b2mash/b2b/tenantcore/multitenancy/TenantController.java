package io.b2mash.b2b.tenantcore.multitenancy;

import io.b2mash.b2b.tenantcore.migration.MigrationSet;
import io.b2mash.b2b.tenantcore.migration.TenantMigrator;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Reports the tenant the caller is bound to, read through a session routed to its schema. */
@RestController
@RequestMapping("/api/tenant")
public class TenantController {

  private final SchemaRouter schemaRouter;
  private final TenantMigrator tenantMigrator;
  private final MigrationSet migrationSet;

  public TenantController(
      SchemaRouter schemaRouter, TenantMigrator tenantMigrator, MigrationSet migrationSet) {
    this.schemaRouter = schemaRouter;
    this.tenantMigrator = tenantMigrator;
    this.migrationSet = migrationSet;
  }

  @GetMapping
  public ResponseEntity<TenantResponse> currentTenant() {
    TenantContext tenant = TenantScope.require();
    try (SchemaSession session = schemaRouter.openSession()) {
      List<String> applied = tenantMigrator.inspect(session, migrationSet).applied();
      return ResponseEntity.ok(
          new TenantResponse(
              tenant.tenantId(), tenant.slug(), session.schema().value(), applied));
    }
  }

  public record TenantResponse(
      UUID tenantId, String slug, String schemaName, List<String> appliedMigrations) {}
}
