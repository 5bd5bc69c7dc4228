package com.example.keyvaultclient.core.secrets;

/**
 * Fetches a single secret from a vault endpoint.
 *
 * <p>Implementations signal throttling by throwing a {@link
 * com.azure.core.exception.HttpResponseException HttpResponseException} (possibly as a cause)
 * whose response carries status 429. Any other exception is treated as a non-retryable failure.
 */
@FunctionalInterface
public interface VaultSecretFetcher {

  /**
   * Fetches a secret.
   *
   * @param vaultUrl vault endpoint, e.g. {@code https://mykv.vault.azure.net/}
   * @param secretName name of the secret inside the vault
   * @param version secret version, empty for the latest
   * @return the secret
   */
  VaultSecret fetchSecret(final String vaultUrl, final String secretName, final String version);
}
