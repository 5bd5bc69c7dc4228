package com.example.keyvaultclient.core.auth;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import java.util.Objects;
import java.util.Optional;

/** Tokens from a client id / secret / tenant exchange against Azure AD. */
public final class ServicePrincipalCredentials implements VaultCredentials {

  private final String clientId;
  private final String clientSecret;
  private final String tenantId;
  private final String authorityHost;
  private TokenCredential credential;

  /**
   * Creates service principal credentials.
   *
   * @param clientId application client id
   * @param clientSecret application client secret
   * @param tenantId tenant id
   * @param authorityHost Azure AD authority of the target cloud
   */
  public ServicePrincipalCredentials(
      final String clientId,
      final String clientSecret,
      final String tenantId,
      final String authorityHost) {
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    this.authorityHost = Objects.requireNonNull(authorityHost, "authorityHost");
  }

  @Override
  public synchronized TokenCredential tokenCredential() {
    return Optional.ofNullable(credential).orElseGet(() -> credential = buildCredential());
  }

  private TokenCredential buildCredential() {
    return new ClientSecretCredentialBuilder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .tenantId(tenantId)
        .authorityHost(authorityHost)
        .build();
  }

  @Override
  public boolean managedIdentity() {
    return false;
  }

  public String clientId() {
    return clientId;
  }

  public String tenantId() {
    return tenantId;
  }

  public String authorityHost() {
    return authorityHost;
  }

  @Override
  public String toString() {
    return "ServicePrincipalCredentials[clientId=" + clientId + ", tenantId=" + tenantId + "]";
  }
}
