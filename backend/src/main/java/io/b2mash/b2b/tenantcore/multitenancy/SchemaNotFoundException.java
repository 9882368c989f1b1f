package io.b2mash.b2b.tenantcore.multitenancy;

public class SchemaNotFoundException extends RuntimeException {

  private final SchemaName schemaName;

  public SchemaNotFoundException(SchemaName schemaName) {
    super("Schema " + schemaName + " does not exist; the tenant needs provisioning");
    this.schemaName = schemaName;
  }

  public SchemaNotFoundException(SchemaName schemaName, String message) {
    super(message);
    this.schemaName = schemaName;
  }

  public SchemaName getSchemaName() {
    return schemaName;
  }
}
