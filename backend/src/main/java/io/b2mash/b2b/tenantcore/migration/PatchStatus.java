package io.b2mash.b2b.tenantcore.migration;

public enum PatchStatus {
  APPLIED,
  ALREADY_APPLIED,
  FAILED
}
