/**
 * Root package for the keyvault-client library.
 *
 * <p>This package contains a small set of focused classes that fetch secrets from Azure Key Vault
 * by vault name, authenticate with either a managed identity or a service principal, and back off
 * when the service throttles requests.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.keyvaultclient.core.KeyVaultSecretClient} – fetches secrets by vault
 *       name with throttling backoff.
 *   <li>{@link com.example.keyvaultclient.core.VaultClientConfig} – credentials and auth mode,
 *       loadable from system properties or environment variables.
 *   <li>{@link com.example.keyvaultclient.core.CloudEnvironment} – vault DNS suffix and authority
 *       of the public and sovereign Azure clouds.
 *   <li>{@link com.example.keyvaultclient.core.VaultUrlTemplate} – renders vault URLs from short
 *       names.
 *   <li>{@link com.example.keyvaultclient.core.Retry} – backoff policy and 429 detection.
 *   <li>{@link com.example.keyvaultclient.core.auth.VaultCredentials} – managed identity and
 *       service principal token sources.
 *   <li>{@link com.example.keyvaultclient.core.secrets.VaultSecretFetcher} – the single-call
 *       secret fetch contract and its Azure SDK implementation.
 *   <li>{@link com.example.keyvaultclient.core.secrets.SecretHelper} – deserializes JSON secrets
 *       with Jackson.
 * </ul>
 */
package com.example.keyvaultclient.core;
