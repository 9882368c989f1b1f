package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.migration.AddColumnsPatch.Column;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Structural patches applied to tenant schemas after the ordered migrations. */
@Configuration
public class TenantSchemaPatches {

  public static final String SALES_CHANNEL_CREDENTIALS = "sales-channel-credentials";

  /** Connection and sync columns for sales channels created before channel sync existed. */
  @Bean
  public SchemaPatch salesChannelCredentialsPatch() {
    return new AddColumnsPatch(
        SALES_CHANNEL_CREDENTIALS,
        "Channel credentials, connection state and sync settings",
        "sales_channels",
        List.of(
            new Column("access_token", "VARCHAR(1000)"),
            new Column("api_key", "VARCHAR(500)"),
            new Column("api_secret", "VARCHAR(500)"),
            new Column("is_connected", "BOOLEAN NOT NULL DEFAULT FALSE"),
            new Column("last_connected_at", "TIMESTAMP WITH TIME ZONE"),
            new Column("last_error", "VARCHAR(1000)"),
            new Column("scopes", "VARCHAR(500)"),
            new Column("initial_sync_days", "INTEGER"),
            new Column("sync_products_enabled", "BOOLEAN NOT NULL DEFAULT TRUE"),
            new Column("auto_sync_products", "BOOLEAN NOT NULL DEFAULT FALSE"),
            new Column("last_product_sync_at", "TIMESTAMP WITH TIME ZONE"),
            new Column("last_inventory_sync_at", "TIMESTAMP WITH TIME ZONE")));
  }
}
