package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

  Optional<Tenant> findBySlugAndDeletedAtIsNull(String slug);

  Optional<Tenant> findByIdAndDeletedAtIsNull(UUID id);

  List<Tenant> findByStatusInAndDeletedAtIsNullOrderByCreatedAtAsc(
      Collection<TenantStatus> statuses);

  List<Tenant> findByDeletedAtIsNullOrderByCreatedAtAsc();
}
