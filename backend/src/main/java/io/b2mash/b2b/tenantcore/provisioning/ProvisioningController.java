package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDirectory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final TenantDirectory tenantDirectory;
  private final TenantProvisioner tenantProvisioner;

  public ProvisioningController(
      TenantDirectory tenantDirectory, TenantProvisioner tenantProvisioner) {
    this.tenantDirectory = tenantDirectory;
    this.tenantProvisioner = tenantProvisioner;
  }

  @PostMapping("/{tenantId}/provision")
  public ResponseEntity<ProvisioningResponse> provisionTenant(
      @PathVariable UUID tenantId, @Valid @RequestBody ProvisioningRequest request) {
    log.info("Received provisioning request for tenant {}", tenantId);
    TenantDescriptor tenant = tenantDirectory.findById(tenantId);

    var result =
        tenantProvisioner.provision(
            tenant.id(),
            tenant.schemaName().value(),
            request.ownerEmail(),
            request.ownerPasswordHash(),
            request.companyName());

    var response =
        new ProvisioningResponse(
            result.tenantId(),
            result.schemaName().value(),
            result.state(),
            result.migrationsApplied(),
            result.alreadyProvisioned()
                ? "Tenant already provisioned"
                : "Tenant provisioned successfully");
    if (result.alreadyProvisioned()) {
      return ResponseEntity.status(409).body(response);
    }
    return ResponseEntity.created(URI.create("/internal/tenants/" + tenantId + "/provisioning"))
        .body(response);
  }

  @GetMapping("/{tenantId}/provisioning")
  public ResponseEntity<ProvisioningStateResponse> provisioningState(@PathVariable UUID tenantId) {
    TenantDescriptor tenant = tenantDirectory.findById(tenantId);
    ProvisioningStep state = tenantProvisioner.currentState(tenant.toContext());
    return ResponseEntity.ok(
        new ProvisioningStateResponse(tenant.id(), tenant.schemaName().value(), state));
  }

  public record ProvisioningRequest(
      @NotBlank(message = "ownerEmail is required") @Email String ownerEmail,
      @NotBlank(message = "ownerPasswordHash is required") String ownerPasswordHash,
      @NotBlank(message = "companyName is required") String companyName) {}

  public record ProvisioningResponse(
      UUID tenantId,
      String schemaName,
      ProvisioningStep state,
      List<String> migrationsApplied,
      String message) {}

  public record ProvisioningStateResponse(
      UUID tenantId, String schemaName, ProvisioningStep state) {}
}
