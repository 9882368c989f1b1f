package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Inserts the tenant's settings row with platform defaults when none exists. */
@Component
public class TenantSettingsSeeder {

  private static final Logger log = LoggerFactory.getLogger(TenantSettingsSeeder.class);

  static final String DEFAULT_CURRENCY = "INR";
  static final String DEFAULT_TIMEZONE = "Asia/Kolkata";
  static final String DEFAULT_DATE_FORMAT = "dd/MM/yyyy";
  static final String DEFAULT_TIME_FORMAT = "HH:mm";
  static final int DEFAULT_LOW_STOCK_THRESHOLD = 10;
  static final int DEFAULT_ORDER_SYNC_INTERVAL_MINUTES = 15;

  public void seed(SchemaSession session, String companyName) {
    session.runInTransaction(
        tx -> {
          if (isSeeded(tx)) {
            return;
          }
          Instant now = Instant.now();
          tx.sql(
                  "INSERT INTO "
                      + tx.qualify("settings").toSql()
                      + " (id, company_name, currency, timezone, date_format, time_format,"
                      + " low_stock_threshold, order_sync_interval_minutes, auto_confirm_orders,"
                      + " enable_cod, created_at, updated_at)"
                      + " VALUES (:id, :companyName, :currency, :timezone, :dateFormat,"
                      + " :timeFormat, :lowStock, :syncInterval, FALSE, TRUE, :now, :now)")
              .param("id", UUID.randomUUID())
              .param("companyName", companyName)
              .param("currency", DEFAULT_CURRENCY)
              .param("timezone", DEFAULT_TIMEZONE)
              .param("dateFormat", DEFAULT_DATE_FORMAT)
              .param("timeFormat", DEFAULT_TIME_FORMAT)
              .param("lowStock", DEFAULT_LOW_STOCK_THRESHOLD)
              .param("syncInterval", DEFAULT_ORDER_SYNC_INTERVAL_MINUTES)
              .param("now", Timestamp.from(now))
              .update();
          log.info("Created default settings for {} in schema {}", companyName, tx.schema());
        });
  }

  public boolean isSeeded(SchemaSession session) {
    Integer rows =
        session
            .sql("SELECT COUNT(*) FROM " + session.qualify("settings").toSql())
            .query(Integer.class)
            .single();
    return rows != null && rows > 0;
  }
}
