package io.b2mash.b2b.tenantcore.multitenancy;

import io.b2mash.b2b.tenantcore.exception.TenantNotFoundException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only lookups against the tenant directory in the shared schema. */
@Service
@Transactional(readOnly = true)
public class TenantDirectory {

  private final TenantRepository tenantRepository;

  public TenantDirectory(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  /** PENDING and ACTIVE tenants that are not soft-deleted, oldest first. */
  public List<TenantDescriptor> listEligibleTenants() {
    return tenantRepository
        .findByStatusInAndDeletedAtIsNullOrderByCreatedAtAsc(TenantStatus.MIGRATION_ELIGIBLE)
        .stream()
        .map(Tenant::toDescriptor)
        .toList();
  }

  /** Every tenant that is not soft-deleted, regardless of status. */
  public List<TenantDescriptor> listAll() {
    return tenantRepository.findByDeletedAtIsNullOrderByCreatedAtAsc().stream()
        .map(Tenant::toDescriptor)
        .toList();
  }

  /**
   * Resolves a tenant by UUID or by slug (case-insensitive).
   *
   * @throws TenantNotFoundException when nothing matches, the tenant is soft-deleted or the
   *     identifier is blank
   */
  public TenantDescriptor resolve(String slugOrId) {
    if (slugOrId == null || slugOrId.isBlank()) {
      throw new TenantNotFoundException(slugOrId);
    }
    String identifier = slugOrId.trim();
    Optional<Tenant> tenant =
        parseUuid(identifier).flatMap(tenantRepository::findByIdAndDeletedAtIsNull);
    if (tenant.isEmpty()) {
      tenant =
          tenantRepository.findBySlugAndDeletedAtIsNull(identifier.toLowerCase(Locale.ROOT));
    }
    return tenant
        .map(Tenant::toDescriptor)
        .orElseThrow(() -> new TenantNotFoundException(identifier));
  }

  public TenantDescriptor findById(UUID tenantId) {
    return tenantRepository
        .findByIdAndDeletedAtIsNull(tenantId)
        .map(Tenant::toDescriptor)
        .orElseThrow(() -> new TenantNotFoundException(tenantId));
  }

  private static Optional<UUID> parseUuid(String value) {
    try {
      return Optional.of(UUID.fromString(value));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
