package com.example.authgateway.adapter.datastore;

/**
 * Closed set of operations allowed to use the service credential, which bypasses row-level
 * security. Request handling for ordinary users never maps onto one of these.
 */
public enum AdministrativeOperation {
  SCHEMA_MIGRATION,
  AUDIT_EXPORT
}
