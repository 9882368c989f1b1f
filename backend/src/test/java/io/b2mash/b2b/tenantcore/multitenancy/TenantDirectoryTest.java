package io.b2mash.b2b.tenantcore.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.tenantcore.exception.TenantNotFoundException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class TenantDirectoryTest {

  @Mock private TenantRepository tenantRepository;

  private TenantDirectory directory;

  @BeforeEach
  void setUp() {
    directory = new TenantDirectory(tenantRepository);
  }

  @Test
  void listEligibleTenants_queriesPendingAndActiveOnly() {
    var acme = new Tenant("Acme", "acme", null);
    when(tenantRepository.findByStatusInAndDeletedAtIsNullOrderByCreatedAtAsc(
            TenantStatus.MIGRATION_ELIGIBLE))
        .thenReturn(List.of(acme));

    List<TenantDescriptor> tenants = directory.listEligibleTenants();

    assertThat(tenants).extracting(TenantDescriptor::slug).containsExactly("acme");
    assertThat(tenants.get(0).schemaName()).isEqualTo(SchemaName.of("tenant_acme"));
    assertThat(TenantStatus.MIGRATION_ELIGIBLE)
        .containsExactlyInAnyOrder(TenantStatus.PENDING, TenantStatus.ACTIVE);
  }

  @Test
  void resolve_bySlugIsCaseInsensitive() {
    var acme = new Tenant("Acme", "acme", null);
    when(tenantRepository.findBySlugAndDeletedAtIsNull("acme")).thenReturn(Optional.of(acme));

    assertThat(directory.resolve(" ACME ").slug()).isEqualTo("acme");
    verify(tenantRepository, never()).findByIdAndDeletedAtIsNull(any());
  }

  @Test
  void resolve_byIdPrefersIdLookup() {
    var acme = new Tenant("Acme", "acme", null);
    UUID id = UUID.randomUUID();
    when(tenantRepository.findByIdAndDeletedAtIsNull(id)).thenReturn(Optional.of(acme));

    assertThat(directory.resolve(id.toString()).slug()).isEqualTo("acme");
    verify(tenantRepository, never()).findBySlugAndDeletedAtIsNull(any());
  }

  @Test
  void resolve_missOrSoftDeletedThrowsNotFound() {
    when(tenantRepository.findBySlugAndDeletedAtIsNull("gone")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> directory.resolve("gone"))
        .isInstanceOf(TenantNotFoundException.class)
        .satisfies(
            e -> {
              var notFound = (TenantNotFoundException) e;
              assertThat(notFound.getIdentifier()).isEqualTo("gone");
              assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            });
  }

  @Test
  void resolve_blankIdentifierThrowsNotFound() {
    assertThatThrownBy(() -> directory.resolve("  "))
        .isInstanceOf(TenantNotFoundException.class);
    assertThatThrownBy(() -> directory.resolve(null)).isInstanceOf(TenantNotFoundException.class);
  }

  @Test
  void findById_missingThrowsNotFound() {
    UUID id = UUID.randomUUID();
    when(tenantRepository.findByIdAndDeletedAtIsNull(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> directory.findById(id)).isInstanceOf(TenantNotFoundException.class);
  }
}
