package com.example.keyvaultclient.core.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/**
 * Deserializes JSON secret values using Jackson.
 *
 * <p>Useful for secrets that hold a structured payload, such as a connection descriptor, rather
 * than a single opaque string.
 */
public final class SecretHelper {

  private static volatile Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private SecretHelper() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Parses a secret value into the given type.
   *
   * @param secretName name of the secret, used in error messages
   * @param value raw JSON value
   * @param type target type
   * @param <T> target type
   * @return the parsed value
   * @throws IllegalStateException if the value is not valid JSON for {@code type}
   */
  public static <T> T parse(final String secretName, final String value, final Class<T> type) {
    if (value == null) throw new IllegalStateException("Secret " + secretName + " has no value");
    try {
      return mapperSupplier.get().readValue(value, type);
    } catch (final Exception exception) {
      throw new IllegalStateException(
          "Failed to parse secret " + secretName + " as " + type.getSimpleName(), exception);
    }
  }
}
