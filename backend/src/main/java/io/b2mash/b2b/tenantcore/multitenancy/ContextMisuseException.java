package io.b2mash.b2b.tenantcore.multitenancy;

/**
 * Raised when tenant context rules are broken: a second binding inside a bound unit of work,
 * tenant-scoped access with nothing bound, or a statement that would leave the session's schema.
 */
public class ContextMisuseException extends RuntimeException {

  public ContextMisuseException(String message) {
    super(message);
  }
}
