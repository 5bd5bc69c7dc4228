package com.example.keyvaultclient.core;

import java.util.Optional;

/**
 * Credentials and cloud settings for a {@link KeyVaultSecretClient}.
 *
 * <p>Either {@code useManagedIdentity} is set, in which case {@code clientId} optionally selects a
 * user-assigned identity, or {@code clientId}, {@code clientSecret} and {@code tenantId} must all
 * be present. The invariant is checked when the client is built, not here.
 *
 * <p>{@link #fromEnvironment()} reads system properties first, then environment variables:
 *
 * <ul>
 *   <li>azure.client.id / AZURE_CLIENT_ID
 *   <li>azure.client.secret / AZURE_CLIENT_SECRET
 *   <li>azure.tenant.id / AZURE_TENANT_ID
 *   <li>azure.keyvault.use.msi / AZURE_KEYVAULT_USE_MSI
 *   <li>azure.cloud / AZURE_CLOUD (optional, default AzureCloud)
 * </ul>
 *
 * @param clientId application or user-assigned identity client id
 * @param clientSecret client secret of the service principal
 * @param tenantId Azure AD tenant of the service principal
 * @param useManagedIdentity whether tokens come from the managed identity endpoint
 * @param cloud cloud endpoints, defaults to {@link CloudEnvironment#AZURE_PUBLIC}
 */
public record VaultClientConfig(
    String clientId,
    String clientSecret,
    String tenantId,
    boolean useManagedIdentity,
    CloudEnvironment cloud) {

  public VaultClientConfig {
    cloud = Optional.ofNullable(cloud).orElse(CloudEnvironment.AZURE_PUBLIC);
  }

  /** Managed identity config using the system-assigned identity. */
  public static VaultClientConfig managedIdentity() {
    return managedIdentity(null);
  }

  /**
   * Managed identity config.
   *
   * @param clientId client id of a user-assigned identity, or null for the system-assigned one
   * @return config
   */
  public static VaultClientConfig managedIdentity(final String clientId) {
    return new VaultClientConfig(clientId, null, null, true, null);
  }

  /**
   * Service principal config.
   *
   * @param clientId application client id
   * @param clientSecret application client secret
   * @param tenantId tenant id
   * @return config
   */
  public static VaultClientConfig servicePrincipal(
      final String clientId, final String clientSecret, final String tenantId) {
    return new VaultClientConfig(clientId, clientSecret, tenantId, false, null);
  }

  /**
   * Returns a copy of this config bound to another cloud.
   *
   * @param cloud target cloud
   * @return config
   */
  public VaultClientConfig withCloud(final CloudEnvironment cloud) {
    return new VaultClientConfig(clientId, clientSecret, tenantId, useManagedIdentity, cloud);
  }

  /**
   * Builds a config from system properties and environment variables.
   *
   * @return config
   * @throws VaultConfigurationException if the configured cloud name is unknown
   */
  public static VaultClientConfig fromEnvironment() {
    final var cloud =
        setting("azure.cloud", "AZURE_CLOUD")
            .map(CloudEnvironment::fromName)
            .orElse(CloudEnvironment.AZURE_PUBLIC);
    final var useMsi =
        setting("azure.keyvault.use.msi", "AZURE_KEYVAULT_USE_MSI")
            .map(Boolean::parseBoolean)
            .orElse(false);
    return new VaultClientConfig(
        setting("azure.client.id", "AZURE_CLIENT_ID").orElse(null),
        setting("azure.client.secret", "AZURE_CLIENT_SECRET").orElse(null),
        setting("azure.tenant.id", "AZURE_TENANT_ID").orElse(null),
        useMsi,
        cloud);
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  /**
   * Whether the service principal fields are all present.
   *
   * @return true if client id, secret and tenant id are non-blank
   */
  public boolean hasServicePrincipal() {
    return isPresent(clientId) && isPresent(clientSecret) && isPresent(tenantId);
  }

  private static boolean isPresent(final String value) {
    return value != null && !value.isBlank();
  }

  @Override
  public String toString() {
    return "VaultClientConfig[clientId=%s, clientSecret=%s, tenantId=%s, useManagedIdentity=%s, cloud=%s]"
        .formatted(
            clientId, clientSecret == null ? null : "****", tenantId, useManagedIdentity, cloud.name());
  }
}
