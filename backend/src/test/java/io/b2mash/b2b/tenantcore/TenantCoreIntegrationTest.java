package io.b2mash.b2b.tenantcore;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.tenantcore.migration.TenantSchemaPatches;
import io.b2mash.b2b.tenantcore.multitenancy.Tenant;
import io.b2mash.b2b.tenantcore.multitenancy.TenantRepository;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end wiring: operator endpoints behind the API key, provisioning into a real schema, and
 * JWT requests routed to the tenant named in the token.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenantCoreIntegrationTest {

  private static final String API_KEY = "test-api-key";
  private static final String SLUG = "it-acme";

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantRepository tenantRepository;

  private UUID tenantId;
  private UUID unprovisionedTenantId;

  @BeforeAll
  void provisionTenant() throws Exception {
    tenantId = tenantRepository.save(new Tenant("IT Acme", SLUG, "ops@it-acme.test")).getId();
    // suspended tenants are skipped by migration runs, so this schema is never created
    var suspended = new Tenant("IT Suspended", "it-suspended", null);
    suspended.suspend();
    unprovisionedTenantId = tenantRepository.save(suspended).getId();

    mockMvc
        .perform(
            post("/internal/tenants/" + tenantId + "/provision")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"ownerEmail": "owner@it-acme.test",
                     "ownerPasswordHash": "$2a$10$hash",
                     "companyName": "IT Acme"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.state").value("READY"))
        .andExpect(jsonPath("$.schemaName").value("tenant_it_acme"))
        .andExpect(jsonPath("$.migrationsApplied", contains("1", "2", "3")));
  }

  @Test
  void internalEndpointsRequireApiKey() throws Exception {
    mockMvc.perform(get("/internal/migrations/status")).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/internal/migrations/status").header("X-API-KEY", "wrong-key"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void provisioningTwiceReportsConflict() throws Exception {
    mockMvc
        .perform(
            post("/internal/tenants/" + tenantId + "/provision")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"ownerEmail": "owner@it-acme.test",
                     "ownerPasswordHash": "$2a$10$hash",
                     "companyName": "IT Acme"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.message").value("Tenant already provisioned"));
  }

  @Test
  void provisioningRejectsInvalidRequest() throws Exception {
    mockMvc
        .perform(
            post("/internal/tenants/" + tenantId + "/provision")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"ownerEmail": "not-an-email", "ownerPasswordHash": "", "companyName": "X"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void provisioningUnknownTenantReturnsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/internal/tenants/" + UUID.randomUUID() + "/provisioning")
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Tenant not found"));
  }

  @Test
  void provisioningStateReflectsSchema() throws Exception {
    mockMvc
        .perform(
            get("/internal/tenants/" + tenantId + "/provisioning").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("READY"));
    mockMvc
        .perform(
            get("/internal/tenants/" + unprovisionedTenantId + "/provisioning")
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("NOT_PROVISIONED"));
  }

  @Test
  void currentTenantIsRoutedFromJwtClaim() throws Exception {
    mockMvc
        .perform(get("/api/tenant").with(tenantJwt(SLUG)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.slug").value(SLUG))
        .andExpect(jsonPath("$.schemaName").value("tenant_it_acme"))
        .andExpect(jsonPath("$.appliedMigrations", contains("1", "2", "3")));
  }

  @Test
  void tenantClaimMayCarryTenantId() throws Exception {
    mockMvc
        .perform(get("/api/tenant").with(tenantJwt(tenantId.toString())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tenantId").value(tenantId.toString()));
  }

  @Test
  void unknownTenantIsForbidden() throws Exception {
    mockMvc
        .perform(get("/api/tenant").with(tenantJwt("no-such-tenant")))
        .andExpect(status().isForbidden());
  }

  @Test
  void tenantWithoutSchemaIsReportedAsNotProvisioned() throws Exception {
    mockMvc
        .perform(get("/api/tenant").with(tenantJwt("it-suspended")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Tenant not provisioned"));
  }

  @Test
  void tokenWithoutTenantClaimCannotReachTenantData() throws Exception {
    mockMvc
        .perform(get("/api/tenant").with(jwt().jwt(j -> j.subject("user_no_tenant"))))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.title").value("Tenant context not available"));
  }

  @Test
  void unauthenticatedApiRequestIsRejected() throws Exception {
    mockMvc.perform(get("/api/tenant")).andExpect(status().isUnauthorized());
  }

  @Test
  void migrationRunAndStatusCoverProvisionedTenant() throws Exception {
    mockMvc
        .perform(post("/internal/migrations/run").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.failed").isEmpty());

    mockMvc
        .perform(get("/internal/migrations/status").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.locations", contains("classpath:db/migration/tenant")))
        .andExpect(jsonPath("$.tenants[?(@.slug == 'it-acme')].schemaPresent", hasItem(true)))
        .andExpect(
            jsonPath("$.tenants[?(@.slug == 'it-suspended')].schemaPresent", hasItem(false)))
        .andExpect(jsonPath("$.tenants[?(@.slug == 'it-suspended')].error", hasItem(nullValue())));
  }

  @Test
  void patchListingShowsRegisteredPatches() throws Exception {
    mockMvc
        .perform(get("/internal/migrations/patches").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(TenantSchemaPatches.SALES_CHANNEL_CREDENTIALS)))
        .andExpect(jsonPath("$[*].description", everyItem(notNullValue())));
  }

  @Test
  void patchEndpointAppliesRegisteredPatch() throws Exception {
    mockMvc
        .perform(
            post("/internal/migrations/patches/"
                    + TenantSchemaPatches.SALES_CHANNEL_CREDENTIALS
                    + "/tenants/"
                    + tenantId)
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").isString());

    mockMvc
        .perform(
            post("/internal/migrations/patches/unknown-patch/tenants/" + tenantId)
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isBadRequest());
  }

  private JwtRequestPostProcessor tenantJwt(String tenantIdentifier) {
    return jwt().jwt(j -> j.subject("user_it").claim("tenant_id", tenantIdentifier));
  }
}
