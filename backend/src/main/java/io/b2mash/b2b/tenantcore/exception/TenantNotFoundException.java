package io.b2mash.b2b.tenantcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotFoundException extends ErrorResponseException {

  private final String identifier;

  public TenantNotFoundException(Object identifier) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem("Tenant not found", "No tenant found for identifier " + identifier),
        null);
    this.identifier = String.valueOf(identifier);
  }

  public String getIdentifier() {
    return identifier;
  }

  @Override
  public String getMessage() {
    return "No tenant found for identifier " + identifier;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
