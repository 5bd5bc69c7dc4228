package com.example.keyvaultclient.core.secrets;

/**
 * A secret value fetched from a vault.
 *
 * @param value the secret's value
 * @param version version identifier of the returned value, may be null
 */
public record VaultSecret(String value, String version) {

  @Override
  public String toString() {
    return "VaultSecret[version=" + version + "]";
  }
}
