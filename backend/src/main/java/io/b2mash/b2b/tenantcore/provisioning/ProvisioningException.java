package io.b2mash.b2b.tenantcore.provisioning;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Provisioning stopped before reaching {@link #getFailedStep()}. Re-running resumes from there. */
public class ProvisioningException extends ErrorResponseException {

  private final UUID tenantId;
  private final ProvisioningStep failedStep;

  public ProvisioningException(UUID tenantId, ProvisioningStep failedStep, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(tenantId, failedStep), cause);
    this.tenantId = tenantId;
    this.failedStep = failedStep;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public ProvisioningStep getFailedStep() {
    return failedStep;
  }

  @Override
  public String getMessage() {
    return "Provisioning of tenant " + tenantId + " failed at step " + failedStep;
  }

  private static ProblemDetail createProblem(UUID tenantId, ProvisioningStep failedStep) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Provisioning failed");
    problem.setDetail("Provisioning of tenant " + tenantId + " failed at step " + failedStep);
    problem.setProperty("tenantId", tenantId);
    problem.setProperty("failedStep", failedStep);
    return problem;
  }
}
