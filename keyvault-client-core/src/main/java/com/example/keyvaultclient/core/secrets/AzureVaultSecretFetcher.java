package com.example.keyvaultclient.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.azure.core.credential.TokenCredential;
import com.azure.core.http.policy.FixedDelay;
import com.azure.core.http.policy.RetryPolicy;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.azure.security.keyvault.secrets.models.SecretProperties;
import com.example.keyvaultclient.core.auth.VaultCredentials;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link VaultSecretFetcher} backed by the Azure SDK {@link SecretClient}.
 *
 * <p>One {@link SecretClient} is built per vault URL and reused. The SDK's own retry policy is
 * turned off so throttling surfaces to the caller, which owns the backoff.
 */
public class AzureVaultSecretFetcher implements VaultSecretFetcher {

  private static final System.Logger LOGGER =
      System.getLogger(AzureVaultSecretFetcher.class.getName());

  private final ConcurrentHashMap<String, SecretClient> clients = new ConcurrentHashMap<>();
  private final Function<String, SecretClient> clientFactory;

  /**
   * Creates a fetcher authenticating with the given credentials.
   *
   * @param credentials token source for every vault this fetcher talks to
   */
  public AzureVaultSecretFetcher(final VaultCredentials credentials) {
    this(vaultUrl -> buildClient(vaultUrl, credentials.tokenCredential()));
  }

  AzureVaultSecretFetcher(final Function<String, SecretClient> clientFactory) {
    this.clientFactory = clientFactory;
  }

  private static SecretClient buildClient(final String vaultUrl, final TokenCredential credential) {
    LOGGER.log(DEBUG, "Building secret client for {0}", vaultUrl);
    return new SecretClientBuilder()
        .vaultUrl(vaultUrl)
        .credential(credential)
        .retryPolicy(new RetryPolicy(new FixedDelay(0, Duration.ofMillis(1))))
        .buildClient();
  }

  /** Returns the cached client for a vault, building it on first use. */
  SecretClient clientFor(final String vaultUrl) {
    return clients.computeIfAbsent(vaultUrl, clientFactory);
  }

  @Override
  public VaultSecret fetchSecret(
      final String vaultUrl, final String secretName, final String version) {
    final var secret =
        clientFor(vaultUrl).getSecret(secretName, Optional.ofNullable(version).orElse(""));
    final var resolvedVersion =
        Optional.ofNullable(secret.getProperties()).map(SecretProperties::getVersion).orElse(version);
    return new VaultSecret(secret.getValue(), resolvedVersion);
  }
}
