package io.b2mash.b2b.tenantcore.provisioning;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** The system roles seeded into every new tenant and the permissions each one holds. */
public final class DefaultRoles {

  public static final String OWNER = "Owner";
  public static final String ADMIN = "Admin";
  public static final String MANAGER = "Manager";
  public static final String STAFF = "Staff";

  /** Permissions reserved to the Owner even among administrators. */
  static final Set<String> OWNER_ONLY = Set.of("security.force_logout", "security.export_approve");

  public record RoleDefinition(String name, String description, Set<String> permissionCodes) {}

  public static final List<RoleDefinition> ALL =
      List.of(
          new RoleDefinition(OWNER, "Full access to all features", PermissionCatalog.codes()),
          new RoleDefinition(
              ADMIN,
              "Administrative access without owner-only security actions",
              PermissionCatalog.codes().stream()
                  .filter(code -> !OWNER_ONLY.contains(code))
                  .collect(Collectors.toUnmodifiableSet())),
          new RoleDefinition(
              MANAGER,
              "Manage orders, shipments and daily operations",
              Set.of(
                  "orders.view",
                  "orders.create",
                  "orders.edit",
                  "orders.cancel",
                  "orders.export",
                  "shipments.view",
                  "shipments.create",
                  "shipments.cancel",
                  "shipments.track",
                  "shipments.export",
                  "ndr.view",
                  "ndr.action",
                  "ndr.reattempt",
                  "inventory.view",
                  "inventory.adjust",
                  "team.view",
                  "analytics.view",
                  "data.view_masked")),
          new RoleDefinition(
              STAFF,
              "Day-to-day order handling",
              Set.of(
                  "orders.view",
                  "orders.create",
                  "shipments.view",
                  "shipments.track",
                  "ndr.view",
                  "ndr.action",
                  "inventory.view",
                  "data.view_masked")));

  private DefaultRoles() {}
}
