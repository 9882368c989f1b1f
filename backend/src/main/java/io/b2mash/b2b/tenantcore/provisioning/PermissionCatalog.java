package io.b2mash.b2b.tenantcore.provisioning;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Permissions every tenant schema carries. Codes are stable, display text may change. */
public final class PermissionCatalog {

  public record PermissionDefinition(String code, String name, String module, String description) {}

  public static final List<PermissionDefinition> ALL =
      List.of(
          permission("orders.view", "View Orders", "orders", "View order list and details"),
          permission("orders.create", "Create Orders", "orders", "Create new orders"),
          permission("orders.edit", "Edit Orders", "orders", "Edit order details"),
          permission("orders.cancel", "Cancel Orders", "orders", "Cancel orders"),
          permission("orders.export", "Export Orders", "orders", "Export order data"),
          permission(
              "orders.bulk", "Bulk Order Operations", "orders", "Perform bulk updates on orders"),
          permission(
              "shipments.view", "View Shipments", "shipments", "View shipment list and details"),
          permission("shipments.create", "Create Shipments", "shipments", "Create new shipments"),
          permission("shipments.cancel", "Cancel Shipments", "shipments", "Cancel shipments"),
          permission(
              "shipments.track", "Track Shipments", "shipments", "View tracking information"),
          permission(
              "shipments.bulk",
              "Bulk Shipment Operations",
              "shipments",
              "Perform bulk shipment creation"),
          permission("shipments.export", "Export Shipments", "shipments", "Export shipment data"),
          permission("ndr.view", "View NDR", "ndr", "View NDR inbox and records"),
          permission("ndr.action", "NDR Actions", "ndr", "Perform NDR actions (call, message)"),
          permission("ndr.assign", "Assign NDR", "ndr", "Assign NDR to employees"),
          permission("ndr.reattempt", "Schedule Reattempt", "ndr", "Schedule delivery reattempts"),
          permission("ndr.export", "Export NDR", "ndr", "Export NDR data"),
          permission(
              "ndr.bulk", "Bulk NDR Operations", "ndr", "Perform bulk NDR assign/status updates"),
          permission(
              "inventory.view", "View Inventory", "inventory", "View products and stock levels"),
          permission("inventory.create", "Create Products", "inventory", "Create new products"),
          permission("inventory.edit", "Edit Products", "inventory", "Edit product details"),
          permission("inventory.adjust", "Adjust Stock", "inventory", "Adjust stock levels"),
          permission("inventory.export", "Export Inventory", "inventory", "Export inventory data"),
          permission("channels.view", "View Channels", "channels", "View connected sales channels"),
          permission(
              "channels.connect", "Connect Channels", "channels", "Connect new sales channels"),
          permission(
              "channels.disconnect", "Disconnect Channels", "channels", "Disconnect channels"),
          permission(
              "channels.settings", "Channel Settings", "channels", "Manage channel settings"),
          permission(
              "channels.sync",
              "Sync Channels",
              "channels",
              "Trigger manual order and inventory sync"),
          permission("team.view", "View Team", "team", "View team members"),
          permission("team.invite", "Invite Users", "team", "Invite new team members"),
          permission("team.edit", "Edit Users", "team", "Edit user details"),
          permission("team.delete", "Delete Users", "team", "Remove team members"),
          permission("team.roles", "Manage Roles", "team", "Create and manage roles"),
          permission("finance.view", "View Finance", "finance", "View financial reports"),
          permission("finance.create", "Create Expenses", "finance", "Record expenses"),
          permission("finance.export", "Export Finance", "finance", "Export financial data"),
          permission("settings.view", "View Settings", "settings", "View tenant settings"),
          permission("settings.edit", "Edit Settings", "settings", "Modify tenant settings"),
          permission("analytics.view", "View Analytics", "analytics", "View analytics dashboard"),
          permission(
              "analytics.export", "Export Analytics", "analytics", "Export analytics reports"),
          permission(
              "webhooks.view", "View Webhooks", "webhooks", "View webhook subscriptions and logs"),
          permission(
              "webhooks.manage",
              "Manage Webhooks",
              "webhooks",
              "Create, edit, and delete webhook subscriptions"),
          permission("audit.view", "View Audit Logs", "audit", "View audit log entries"),
          permission("audit.export", "Export Audit Logs", "audit", "Export audit log data"),
          permission("security.view", "View Security", "security", "View security settings"),
          permission(
              "security.configure", "Configure Security", "security", "Modify security settings"),
          permission("security.audit_logs", "View Audit Logs", "security", "Access audit logs"),
          permission(
              "security.export_approve", "Approve Exports", "security", "Approve large exports"),
          permission(
              "security.sessions", "Manage Sessions", "security", "View and manage user sessions"),
          permission("security.force_logout", "Force Logout", "security", "Force logout users"),
          permission(
              "data.view_masked", "View Masked Data", "data_access", "View masked sensitive data"),
          permission("data.view_full", "View Full Data", "data_access", "View unmasked data"),
          permission("data.copy", "Copy Data", "data_access", "Copy data from UI"),
          permission("data.print", "Print Data", "data_access", "Print pages"),
          permission("export.orders_csv", "Export Orders CSV", "export", "Export orders as CSV"),
          permission(
              "export.orders_excel", "Export Orders Excel", "export", "Export orders as Excel"),
          permission("export.customers", "Export Customers", "export", "Export customer data"),
          permission("export.financial", "Export Financial", "export", "Export financial data"),
          permission("export.ndr", "Export NDR", "export", "Export NDR records"),
          permission("export.inventory", "Export Inventory", "export", "Export inventory data"),
          permission("export.analytics", "Export Analytics", "export", "Export analytics reports"),
          permission("export.bulk_api", "Bulk API Export", "export", "Access bulk export API"));

  private PermissionCatalog() {}

  public static Set<String> codes() {
    return ALL.stream().map(PermissionDefinition::code).collect(Collectors.toUnmodifiableSet());
  }

  private static PermissionDefinition permission(
      String code, String name, String module, String description) {
    return new PermissionDefinition(code, name, module, description);
  }
}
