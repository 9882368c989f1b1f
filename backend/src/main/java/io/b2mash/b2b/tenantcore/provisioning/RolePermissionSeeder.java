package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.provisioning.DefaultRoles.RoleDefinition;
import io.b2mash.b2b.tenantcore.provisioning.PermissionCatalog.PermissionDefinition;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Seeds the permission catalog and the default roles into a tenant schema. Safe to re-run: missing
 * permissions are added (and granted to an existing Owner role), existing rows are left alone.
 */
@Component
public class RolePermissionSeeder {

  private static final Logger log = LoggerFactory.getLogger(RolePermissionSeeder.class);

  public void seed(SchemaSession session) {
    session.runInTransaction(
        tx -> {
          List<String> addedCodes = syncPermissions(tx);
          Map<String, UUID> permissionIds = permissionIds(tx);
          Optional<UUID> ownerRoleId = findRoleId(tx, DefaultRoles.OWNER);

          if (ownerRoleId.isPresent()) {
            for (String code : addedCodes) {
              grant(tx, ownerRoleId.get(), permissionIds.get(code));
            }
            if (!addedCodes.isEmpty()) {
              log.info(
                  "Granted {} new permissions to Owner in schema {}",
                  addedCodes.size(),
                  tx.schema());
            }
            return;
          }

          for (RoleDefinition role : DefaultRoles.ALL) {
            UUID roleId = findRoleId(tx, role.name()).orElseGet(() -> insertRole(tx, role));
            for (String code : role.permissionCodes()) {
              grant(tx, roleId, permissionIds.get(code));
            }
          }
          log.info("Seeded {} default roles in schema {}", DefaultRoles.ALL.size(), tx.schema());
        });
  }

  public boolean isSeeded(SchemaSession session) {
    return findRoleId(session, DefaultRoles.OWNER).isPresent();
  }

  private List<String> syncPermissions(SchemaSession tx) {
    Map<String, UUID> existing = permissionIds(tx);
    List<String> added = new ArrayList<>();
    for (PermissionDefinition permission : PermissionCatalog.ALL) {
      if (existing.containsKey(permission.code())) {
        continue;
      }
      tx.sql(
              "INSERT INTO "
                  + tx.qualify("permissions").toSql()
                  + " (id, code, name, module, description)"
                  + " VALUES (:id, :code, :name, :module, :description)")
          .param("id", UUID.randomUUID())
          .param("code", permission.code())
          .param("name", permission.name())
          .param("module", permission.module())
          .param("description", permission.description())
          .update();
      added.add(permission.code());
    }
    if (!added.isEmpty()) {
      log.debug("Added {} permissions to schema {}", added.size(), tx.schema());
    }
    return added;
  }

  private Map<String, UUID> permissionIds(SchemaSession tx) {
    Map<String, UUID> ids = new HashMap<>();
    tx.sql("SELECT id, code FROM " + tx.qualify("permissions").toSql())
        .query((rs, rowNum) -> Map.entry(rs.getString("code"), rs.getObject("id", UUID.class)))
        .list()
        .forEach(entry -> ids.put(entry.getKey(), entry.getValue()));
    return ids;
  }

  private Optional<UUID> findRoleId(SchemaSession tx, String name) {
    return tx.sql("SELECT id FROM " + tx.qualify("roles").toSql() + " WHERE name = :name")
        .param("name", name)
        .query(UUID.class)
        .optional();
  }

  private UUID insertRole(SchemaSession tx, RoleDefinition role) {
    UUID id = UUID.randomUUID();
    tx.sql(
            "INSERT INTO "
                + tx.qualify("roles").toSql()
                + " (id, name, description, is_system, created_at)"
                + " VALUES (:id, :name, :description, TRUE, :createdAt)")
        .param("id", id)
        .param("name", role.name())
        .param("description", role.description())
        .param("createdAt", Timestamp.from(Instant.now()))
        .update();
    return id;
  }

  private void grant(SchemaSession tx, UUID roleId, UUID permissionId) {
    if (permissionId == null) {
      return;
    }
    Integer existing =
        tx.sql(
                "SELECT COUNT(*) FROM "
                    + tx.qualify("role_permissions").toSql()
                    + " WHERE role_id = :roleId AND permission_id = :permissionId")
            .param("roleId", roleId)
            .param("permissionId", permissionId)
            .query(Integer.class)
            .single();
    if (existing != null && existing > 0) {
      return;
    }
    tx.sql(
            "INSERT INTO "
                + tx.qualify("role_permissions").toSql()
                + " (role_id, permission_id) VALUES (:roleId, :permissionId)")
        .param("roleId", roleId)
        .param("permissionId", permissionId)
        .update();
  }
}
