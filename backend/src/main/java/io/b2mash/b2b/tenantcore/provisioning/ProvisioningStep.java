package io.b2mash.b2b.tenantcore.provisioning;

/** Provisioning states in the order they are reached. */
public enum ProvisioningStep {
  NOT_PROVISIONED,
  SCHEMA_CREATED,
  ROLES_SEEDED,
  OWNER_CREATED,
  SETTINGS_CREATED,
  READY
}
