package com.example.keyvaultclient.core.auth;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ManagedIdentityCredentialBuilder;
import java.util.Optional;

/** Tokens from a system-assigned or user-assigned managed identity. */
public final class ManagedIdentityCredentials implements VaultCredentials {

  private final String clientId; // nullable, selects a user-assigned identity
  private TokenCredential credential;

  /**
   * Creates managed identity credentials.
   *
   * @param clientId client id of a user-assigned identity, or null for the system-assigned one
   */
  public ManagedIdentityCredentials(final String clientId) {
    this.clientId = Optional.ofNullable(clientId).filter(id -> !id.isBlank()).orElse(null);
  }

  @Override
  public synchronized TokenCredential tokenCredential() {
    return Optional.ofNullable(credential).orElseGet(() -> credential = buildCredential());
  }

  private TokenCredential buildCredential() {
    final var builder = new ManagedIdentityCredentialBuilder();
    Optional.ofNullable(clientId).ifPresent(builder::clientId);
    return builder.build();
  }

  @Override
  public boolean managedIdentity() {
    return true;
  }

  /** Client id of the user-assigned identity, empty for the system-assigned one. */
  public Optional<String> clientId() {
    return Optional.ofNullable(clientId);
  }

  @Override
  public String toString() {
    return "ManagedIdentityCredentials[clientId=" + clientId + "]";
  }
}
