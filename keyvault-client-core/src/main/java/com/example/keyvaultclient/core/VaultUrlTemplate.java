package com.example.keyvaultclient.core;

/**
 * Per-vault endpoint URL template, e.g. {@code https://{name}.vault.azure.net/}.
 *
 * <p>Built once from a cloud's vault DNS suffix; immutable afterwards.
 */
public final class VaultUrlTemplate {

  static final String PLACEHOLDER = "{name}";

  private final String template;

  private VaultUrlTemplate(final String template) {
    this.template = template;
  }

  /**
   * Creates a template that inserts the vault name as the subdomain of {@code dnsSuffix}.
   *
   * @param dnsSuffix vault DNS suffix, with or without the leading dot
   * @return template
   */
  public static VaultUrlTemplate forDnsSuffix(final String dnsSuffix) {
    if (dnsSuffix == null || dnsSuffix.isBlank())
      throw new VaultConfigurationException("vault DNS suffix is required");
    var suffix = dnsSuffix.trim();
    while (suffix.endsWith("/")) suffix = suffix.substring(0, suffix.length() - 1);
    if (!suffix.startsWith(".")) suffix = "." + suffix;
    return new VaultUrlTemplate("https://" + PLACEHOLDER + suffix + "/");
  }

  /**
   * Creates a template for the given cloud.
   *
   * @param cloud cloud endpoints
   * @return template
   */
  public static VaultUrlTemplate forCloud(final CloudEnvironment cloud) {
    return forDnsSuffix(cloud.vaultDnsSuffix());
  }

  /**
   * Renders the URL of a vault.
   *
   * @param vaultName short vault name, e.g. {@code mykv}
   * @return vault URL, e.g. {@code https://mykv.vault.azure.net/}
   * @throws IllegalArgumentException if the name is null or blank
   */
  public String render(final String vaultName) {
    if (vaultName == null || vaultName.isBlank())
      throw new IllegalArgumentException("vaultName must not be blank");
    return template.replace(PLACEHOLDER, vaultName.trim());
  }

  /** Returns the raw template string. */
  public String template() {
    return template;
  }

  @Override
  public String toString() {
    return template;
  }
}
