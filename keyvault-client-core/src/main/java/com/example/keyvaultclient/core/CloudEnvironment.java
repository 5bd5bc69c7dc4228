package com.example.keyvaultclient.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Endpoints of an Azure cloud that matter to Key Vault clients.
 *
 * @param name cloud name, e.g. {@code AzureCloud}
 * @param vaultDnsSuffix DNS suffix appended to a vault name, e.g. {@code .vault.azure.net}
 * @param authorityHost Azure AD authority used for client-credential token exchange
 * @param vaultResource resource identifier tokens are requested for
 */
public record CloudEnvironment(
    String name, String vaultDnsSuffix, String authorityHost, String vaultResource) {

  public static final CloudEnvironment AZURE_PUBLIC =
      new CloudEnvironment(
          "AzureCloud",
          ".vault.azure.net",
          "https://login.microsoftonline.com/",
          "https://vault.azure.net");

  public static final CloudEnvironment AZURE_CHINA =
      new CloudEnvironment(
          "AzureChinaCloud",
          ".vault.azure.cn",
          "https://login.chinacloudapi.cn/",
          "https://vault.azure.cn");

  public static final CloudEnvironment AZURE_US_GOVERNMENT =
      new CloudEnvironment(
          "AzureUSGovernment",
          ".vault.usgovcloudapi.net",
          "https://login.microsoftonline.us/",
          "https://vault.usgovcloudapi.net");

  private static final List<CloudEnvironment> KNOWN =
      List.of(AZURE_PUBLIC, AZURE_CHINA, AZURE_US_GOVERNMENT);

  public CloudEnvironment {
    requireNonBlank(vaultDnsSuffix, "vaultDnsSuffix");
    requireNonBlank(authorityHost, "authorityHost");
    requireNonBlank(vaultResource, "vaultResource");
  }

  private static void requireNonBlank(final String value, final String field) {
    if (value == null || value.isBlank())
      throw new VaultConfigurationException(field + " is required");
  }

  /**
   * Looks up one of the built-in clouds by name, ignoring case.
   *
   * @param name cloud name
   * @return the matching cloud
   * @throws VaultConfigurationException if the name is unknown
   */
  public static CloudEnvironment fromName(final String name) {
    return Optional.ofNullable(name)
        .map(n -> n.trim().toLowerCase(Locale.ROOT))
        .flatMap(
            n ->
                KNOWN.stream()
                    .filter(cloud -> cloud.name().toLowerCase(Locale.ROOT).equals(n))
                    .findFirst())
        .orElseThrow(() -> new VaultConfigurationException("Unknown Azure cloud: " + name));
  }
}
