package com.example;

import com.example.keyvaultclient.core.KeyVaultSecretClient;
import com.example.keyvaultclient.core.VaultClientConfig;

/**
 * Command line example: fetches one secret using configuration from the environment.
 *
 * <p>Usage: {@code Main <vault-name> <secret-name> [version] [max-retries]}
 */
public class Main {

  public static void main(String[] args) {
    if (args.length < 2) {
      System.err.println("usage: Main <vault-name> <secret-name> [version] [max-retries]");
      System.exit(2);
    }
    final var client = new KeyVaultSecretClient(VaultClientConfig.fromEnvironment());
    final var value = fetch(client, args);
    System.out.println(describe(args[1], value));
  }

  static String fetch(final KeyVaultSecretClient client, final String[] args) {
    final var version = args.length > 2 ? args[2] : KeyVaultSecretClient.LATEST_SECRET_VERSION;
    final var maxRetries = args.length > 3 ? Integer.parseInt(args[3]) : 5;
    return client.getSecretByVaultName(args[0], args[1], version, maxRetries);
  }

  static String describe(final String secretName, final String value) {
    return "Fetched secret %s (%d characters)"
        .formatted(secretName, value == null ? 0 : value.length());
  }
}
