package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Creates the tenant's owner user and assigns the Owner role. */
@Component
public class OwnerAccountSeeder {

  private static final Logger log = LoggerFactory.getLogger(OwnerAccountSeeder.class);

  public void seed(SchemaSession session, String ownerEmail, String ownerPasswordHash) {
    String email = ownerEmail.trim().toLowerCase(Locale.ROOT);
    session.runInTransaction(
        tx -> {
          UUID ownerRoleId =
              findId(tx, "roles", "name", DefaultRoles.OWNER)
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Owner role missing in schema " + tx.schema()));
          UUID userId =
              findId(tx, "users", "email", email)
                  .orElseGet(() -> insertOwner(tx, email, ownerPasswordHash));

          Integer assigned =
              tx.sql(
                      "SELECT COUNT(*) FROM "
                          + tx.qualify("user_roles").toSql()
                          + " WHERE user_id = :userId AND role_id = :roleId")
                  .param("userId", userId)
                  .param("roleId", ownerRoleId)
                  .query(Integer.class)
                  .single();
          if (assigned == null || assigned == 0) {
            tx.sql(
                    "INSERT INTO "
                        + tx.qualify("user_roles").toSql()
                        + " (user_id, role_id) VALUES (:userId, :roleId)")
                .param("userId", userId)
                .param("roleId", ownerRoleId)
                .update();
            log.info("Assigned Owner role to {} in schema {}", email, tx.schema());
          }
        });
  }

  /** Whether any user holds the Owner role. */
  public boolean isSeeded(SchemaSession session) {
    Integer owners =
        session
            .sql(
                "SELECT COUNT(*) FROM "
                    + session.qualify("user_roles").toSql()
                    + " ur JOIN "
                    + session.qualify("roles").toSql()
                    + " r ON r.id = ur.role_id WHERE r.name = :name")
            .param("name", DefaultRoles.OWNER)
            .query(Integer.class)
            .single();
    return owners != null && owners > 0;
  }

  private UUID insertOwner(SchemaSession tx, String email, String passwordHash) {
    UUID id = UUID.randomUUID();
    tx.sql(
            "INSERT INTO "
                + tx.qualify("users").toSql()
                + " (id, email, password_hash, first_name, last_name, email_verified, is_active,"
                + " created_at)"
                + " VALUES (:id, :email, :passwordHash, :firstName, :lastName, TRUE, TRUE,"
                + " :createdAt)")
        .param("id", id)
        .param("email", email)
        .param("passwordHash", passwordHash)
        .param("firstName", "Account")
        .param("lastName", "Owner")
        .param("createdAt", Timestamp.from(Instant.now()))
        .update();
    log.info("Created owner user {} in schema {}", email, tx.schema());
    return id;
  }

  private static Optional<UUID> findId(
      SchemaSession tx, String table, String column, String value) {
    return tx.sql(
            "SELECT id FROM " + tx.qualify(table).toSql() + " WHERE " + column + " = :value")
        .param("value", value)
        .query(UUID.class)
        .optional();
  }
}
