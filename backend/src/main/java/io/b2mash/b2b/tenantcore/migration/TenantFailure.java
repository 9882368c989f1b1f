package io.b2mash.b2b.tenantcore.migration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import java.util.UUID;

/** A tenant that failed inside a batch, with the error that stopped it. */
public record TenantFailure(
    UUID tenantId,
    String slug,
    String schemaName,
    String failedVersion,
    String errorType,
    String message,
    @JsonIgnore Exception error) {

  static TenantFailure of(TenantDescriptor tenant, Exception error) {
    String failedVersion =
        error instanceof MigrationApplyException applyError ? applyError.getVersion() : null;
    return new TenantFailure(
        tenant.id(),
        tenant.slug(),
        tenant.schemaName().value(),
        failedVersion,
        error.getClass().getSimpleName(),
        error.getMessage(),
        error);
  }
}
