package io.b2mash.b2b.tenantcore.multitenancy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** Directory entry for one tenant in the shared schema. */
@Entity
@Table(name = "tenants", schema = "public")
public class Tenant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "slug", nullable = false, unique = true, updatable = false, length = 63)
  private String slug;

  @Column(name = "schema_name", nullable = false, unique = true, updatable = false, length = 63)
  private String schemaName;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenantStatus status;

  @Column(name = "contact_email", length = 320)
  private String contactEmail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Tenant() {}

  public Tenant(String name, String slug, String contactEmail) {
    this.name = name;
    this.slug = slug.toLowerCase(Locale.ROOT);
    this.schemaName = SchemaNameGenerator.fromSlug(this.slug).value();
    this.contactEmail = contactEmail;
    this.status = TenantStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void activate() {
    if (status == TenantStatus.DEACTIVATED) {
      throw new IllegalStateException("Cannot activate a deactivated tenant");
    }
    transitionTo(TenantStatus.ACTIVE);
  }

  public void suspend() {
    if (status == TenantStatus.DEACTIVATED) {
      throw new IllegalStateException("Cannot suspend a deactivated tenant");
    }
    transitionTo(TenantStatus.SUSPENDED);
  }

  public void deactivate() {
    transitionTo(TenantStatus.DEACTIVATED);
  }

  public void markDeleted() {
    this.deletedAt = Instant.now();
    this.updatedAt = this.deletedAt;
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public TenantDescriptor toDescriptor() {
    return new TenantDescriptor(id, SchemaName.of(schemaName), slug, status);
  }

  private void transitionTo(TenantStatus target) {
    this.status = target;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSlug() {
    return slug;
  }

  public String getSchemaName() {
    return schemaName;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public String getContactEmail() {
    return contactEmail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
