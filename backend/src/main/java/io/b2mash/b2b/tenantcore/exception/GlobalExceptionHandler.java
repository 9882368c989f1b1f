package io.b2mash.b2b.tenantcore.exception;

import io.b2mash.b2b.tenantcore.migration.MigrationApplyException;
import io.b2mash.b2b.tenantcore.multitenancy.ContextMisuseException;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ContextMisuseException.class)
  public ResponseEntity<ProblemDetail> handleContextMisuse(
      ContextMisuseException ex, HttpServletRequest request) {
    log.error(
        "Tenant context invariant violation: path={}, reason={}",
        request.getRequestURI(),
        ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Tenant context not available");
    problem.setDetail("Unable to resolve tenant context for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(SchemaNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleSchemaNotFound(SchemaNotFoundException ex) {
    log.warn("Schema missing: {}", ex.getSchemaName());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Tenant not provisioned");
    problem.setDetail(ex.getMessage());
    problem.setProperty("schemaName", String.valueOf(ex.getSchemaName()));
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(MigrationApplyException.class)
  public ResponseEntity<ProblemDetail> handleMigrationFailure(MigrationApplyException ex) {
    log.error("Tenant migration failed: {}", ex.getMessage(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Migration failed");
    problem.setDetail(ex.getMessage());
    if (ex.getTenant() != null) {
      problem.setProperty("tenantId", ex.getTenant().tenantId());
      problem.setProperty("schemaName", ex.getTenant().schemaName().value());
    }
    if (ex.getVersion() != null) {
      problem.setProperty("failedVersion", ex.getVersion());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Rejected request: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
