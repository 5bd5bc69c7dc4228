package com.example.keyvaultclient.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import com.example.keyvaultclient.core.Retry.Policy;
import com.example.keyvaultclient.core.Retry.Sleeper;
import com.example.keyvaultclient.core.auth.VaultCredentials;
import com.example.keyvaultclient.core.secrets.AzureVaultSecretFetcher;
import com.example.keyvaultclient.core.secrets.SecretHelper;
import com.example.keyvaultclient.core.secrets.VaultSecretFetcher;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Optional;

/**
 * Key Vault client that fetches secrets by vault name and authenticates with either a managed
 * identity or a service principal.
 *
 * <p>Throttled requests (HTTP 429) are retried with exponential backoff on the calling thread.
 * Every other failure is logged and rethrown unchanged.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var client = new KeyVaultSecretClient(VaultClientConfig.managedIdentity());
 * String password = client.getSecretByVaultName("mykv", "db-password");
 * }</pre>
 *
 * <h2>Service Principal in a Sovereign Cloud</h2>
 *
 * <pre>{@code
 * var client = KeyVaultSecretClient.builder()
 *     .config(VaultClientConfig.servicePrincipal(clientId, clientSecret, tenantId)
 *         .withCloud(CloudEnvironment.AZURE_US_GOVERNMENT))
 *     .build();
 * }</pre>
 *
 * <h2>Custom Retry Budget</h2>
 *
 * <pre>{@code
 * String value = client.getSecretByVaultName(
 *     "mykv", "api-key", KeyVaultSecretClient.LATEST_SECRET_VERSION, 10);
 * }</pre>
 */
public class KeyVaultSecretClient {

  /** Version value that selects the latest version of a secret. */
  public static final String LATEST_SECRET_VERSION = "";

  private final Logger logger;
  private final VaultUrlTemplate urlTemplate;
  private final VaultCredentials credentials;
  private final VaultSecretFetcher fetcher;
  private final Sleeper sleeper;

  /**
   * Creates a client backed by the Azure SDK.
   *
   * @param config credentials and cloud settings
   * @throws VaultConfigurationException if neither managed identity nor a complete service
   *     principal is configured
   */
  public KeyVaultSecretClient(final VaultClientConfig config) {
    this(builder().config(config));
  }

  private KeyVaultSecretClient(final Builder builder) {
    this.logger =
        Optional.ofNullable(builder.logger)
            .orElseGet(() -> System.getLogger(KeyVaultSecretClient.class.getName()));
    try {
      this.credentials = VaultCredentials.from(builder.config);
    } catch (final VaultConfigurationException e) {
      log(ERROR, e.getMessage());
      throw e;
    }
    this.urlTemplate = VaultUrlTemplate.forCloud(builder.config.cloud());
    this.fetcher =
        Optional.ofNullable(builder.fetcher)
            .orElseGet(() -> new AzureVaultSecretFetcher(credentials));
    this.sleeper = Optional.ofNullable(builder.sleeper).orElseGet(Sleeper::threadSleep);
    log(
        DEBUG,
        "Key Vault client ready: urlTemplate={0} using_msi={1}",
        urlTemplate,
        credentials.managedIdentity());
  }

  /**
   * Creates a new builder.
   *
   * @return builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Fetches the latest version of a secret with the default retry budget.
   *
   * @param vaultName short vault name, e.g. {@code mykv} for {@code https://mykv.vault.azure.net/}
   * @param secretName the secret's name inside the vault
   * @return the secret's value
   */
  public String getSecretByVaultName(final String vaultName, final String secretName) {
    return getSecretByVaultName(vaultName, secretName, LATEST_SECRET_VERSION);
  }

  /**
   * Fetches a secret version with the default retry budget.
   *
   * @param vaultName short vault name
   * @param secretName the secret's name inside the vault
   * @param secretVersion version to fetch, {@link #LATEST_SECRET_VERSION} for the latest
   * @return the secret's value
   */
  public String getSecretByVaultName(
      final String vaultName, final String secretName, final String secretVersion) {
    return getSecretByVaultName(vaultName, secretName, secretVersion, Policy.defaults());
  }

  /**
   * Fetches a secret version, retrying up to {@code maxRetries} times when throttled.
   *
   * @param vaultName short vault name
   * @param secretName the secret's name inside the vault
   * @param secretVersion version to fetch, {@link #LATEST_SECRET_VERSION} for the latest
   * @param maxRetries retries after the first attempt
   * @return the secret's value
   */
  public String getSecretByVaultName(
      final String vaultName,
      final String secretName,
      final String secretVersion,
      final int maxRetries) {
    return getSecretByVaultName(
        vaultName, secretName, secretVersion, Policy.withMaxRetries(maxRetries));
  }

  /**
   * Fetches a secret version using the given backoff policy.
   *
   * <p>Makes up to {@code policy.maxRetries() + 1} attempts. Only HTTP 429 responses are retried;
   * the backoff sleep blocks the calling thread.
   *
   * @param vaultName short vault name
   * @param secretName the secret's name inside the vault
   * @param secretVersion version to fetch, {@link #LATEST_SECRET_VERSION} for the latest
   * @param policy backoff policy
   * @return the secret's value
   * @throws RuntimeException the error raised by the underlying client, unchanged
   */
  public String getSecretByVaultName(
      final String vaultName,
      final String secretName,
      final String secretVersion,
      final Policy policy) {
    final var vaultUrl = urlTemplate.render(vaultName);
    final var version = Optional.ofNullable(secretVersion).orElse(LATEST_SECRET_VERSION);
    try {
      return Retry.onThrottle(
          () -> fetcher.fetchSecret(vaultUrl, secretName, version).value(),
          policy,
          sleeper,
          (attempt, delay, cause) ->
              log(
                  WARNING,
                  "Throttled retrieving secret vault={0} secret={1} version={2} using_msi={3},"
                      + " retrying in {4}s",
                  vaultUrl,
                  secretName,
                  version,
                  credentials.managedIdentity(),
                  delay.toSeconds()));
    } catch (final RuntimeException e) {
      log(
          ERROR,
          "Failed retrieving secret vault={0} secret={1} version={2} using_msi={3}: {4}",
          vaultUrl,
          secretName,
          version,
          credentials.managedIdentity(),
          e.toString());
      throw e;
    }
  }

  /**
   * Fetches the latest version of a JSON secret and deserializes it.
   *
   * @param vaultName short vault name
   * @param secretName the secret's name inside the vault
   * @param type target type
   * @param <T> target type
   * @return the parsed secret
   * @throws IllegalStateException if the value cannot be parsed as {@code type}
   */
  public <T> T getJsonSecretByVaultName(
      final String vaultName, final String secretName, final Class<T> type) {
    return SecretHelper.parse(secretName, getSecretByVaultName(vaultName, secretName), type);
  }

  /**
   * Renders the endpoint URL of a vault.
   *
   * @param vaultName short vault name
   * @return vault URL
   */
  public String vaultUrl(final String vaultName) {
    return urlTemplate.render(vaultName);
  }

  /** Whether this client authenticates with a managed identity. */
  public boolean usesManagedIdentity() {
    return credentials.managedIdentity();
  }

  /** The credentials selected at construction. */
  public VaultCredentials credentials() {
    return credentials;
  }

  private void log(final Level level, final String format, final Object... params) {
    try {
      logger.log(level, format, params);
    } catch (final RuntimeException ignored) {
      // logging must never fail a secret lookup
    }
  }

  /** Builder for {@link KeyVaultSecretClient}. */
  public static class Builder {
    private VaultClientConfig config;
    private Logger logger;
    private VaultSecretFetcher fetcher;
    private Sleeper sleeper;

    private Builder() {}

    /**
     * Sets the credentials and cloud settings (required).
     *
     * @param config client config
     * @return this builder
     */
    public Builder config(final VaultClientConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the logger for errors and throttling warnings.
     *
     * <p>Default: a logger named after this class
     *
     * @param logger logger to use
     * @return this builder
     */
    public Builder logger(final Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Replaces the Azure SDK backed fetcher.
     *
     * <p>Default: {@link AzureVaultSecretFetcher} using the selected credentials
     *
     * @param fetcher secret fetcher
     * @return this builder
     */
    public Builder fetcher(final VaultSecretFetcher fetcher) {
      this.fetcher = fetcher;
      return this;
    }

    /**
     * Sets how backoff delays are waited out.
     *
     * <p>Default: {@link Sleeper#threadSleep()}
     *
     * @param sleeper sleeper
     * @return this builder
     */
    public Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return configured client
     * @throws VaultConfigurationException if the config is missing or invalid
     */
    public KeyVaultSecretClient build() {
      return new KeyVaultSecretClient(this);
    }
  }
}
