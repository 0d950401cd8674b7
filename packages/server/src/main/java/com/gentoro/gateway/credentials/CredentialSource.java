package com.gentoro.gateway.credentials;

/** Supplies the raw credential blob, a JSON array of {@link TenantCredential} records. */
@FunctionalInterface
public interface CredentialSource {

  /**
   * @return the blob, or {@code null} / blank when it is not configured.
   */
  String read();
}
