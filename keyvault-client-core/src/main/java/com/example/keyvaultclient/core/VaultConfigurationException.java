package com.example.keyvaultclient.core;

/** Thrown when a {@link KeyVaultSecretClient} is constructed with an invalid configuration. */
public class VaultConfigurationException extends RuntimeException {

  /**
   * Creates a new configuration exception.
   *
   * @param message description of the configuration problem
   */
  public VaultConfigurationException(final String message) {
    super(message);
  }
}
