package com.example.keyvaultclient.core.auth;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.example.keyvaultclient.core.VaultClientConfig;
import com.example.keyvaultclient.core.VaultConfigurationException;

/**
 * Source of bearer tokens for Key Vault requests.
 *
 * <p>Two implementations exist, selected once by {@link #from(VaultClientConfig)}:
 *
 * <ul>
 *   <li>{@link ManagedIdentityCredentials} – tokens from the platform's managed identity endpoint.
 *   <li>{@link ServicePrincipalCredentials} – tokens from a client-credential exchange.
 * </ul>
 */
public interface VaultCredentials {

  String MISSING_CREDENTIALS =
      "You should either use MSI, or pass a valid client ID, secret and tenant ID";

  /**
   * Returns the Azure credential backing this provider. Built lazily on first use.
   *
   * @return token credential
   */
  TokenCredential tokenCredential();

  /**
   * Whether tokens come from a managed identity.
   *
   * @return true for managed identity, false for a service principal
   */
  boolean managedIdentity();

  /**
   * Acquires a bearer token for a resource.
   *
   * @param resource resource identifier, e.g. {@code https://vault.azure.net}
   * @return access token
   * @throws IllegalArgumentException if the resource is blank
   */
  default AccessToken token(final String resource) {
    if (resource == null || resource.isBlank())
      throw new IllegalArgumentException("resource must not be blank");
    final var scope = resource.endsWith("/") ? resource + ".default" : resource + "/.default";
    return tokenCredential().getTokenSync(new TokenRequestContext().addScopes(scope));
  }

  /**
   * Selects the provider matching the config's auth mode.
   *
   * @param config client config
   * @return managed identity credentials when enabled, otherwise service principal credentials
   * @throws VaultConfigurationException if managed identity is off and the service principal
   *     fields are incomplete
   */
  static VaultCredentials from(final VaultClientConfig config) {
    if (config == null) throw new VaultConfigurationException("config is required");
    if (config.useManagedIdentity()) return new ManagedIdentityCredentials(config.clientId());
    if (!config.hasServicePrincipal()) throw new VaultConfigurationException(MISSING_CREDENTIALS);
    return new ServicePrincipalCredentials(
        config.clientId(),
        config.clientSecret(),
        config.tenantId(),
        config.cloud().authorityHost());
  }
}
