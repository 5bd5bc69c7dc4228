package com.example.keyvaultclient.core;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.HttpResponse;

/** Builds Azure SDK HTTP errors for tests. */
public final class HttpErrors {

  private HttpErrors() {}

  public static HttpResponseException httpError(final int status) {
    final var response = mock(HttpResponse.class);
    when(response.getStatusCode()).thenReturn(status);
    return new HttpResponseException("Status code " + status, response);
  }

  public static HttpResponseException throttled() {
    return httpError(429);
  }
}
