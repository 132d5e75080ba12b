package com.codeheadsystems.keyrelay.client.model;

import java.net.URI;
import java.util.Objects;

/**
 * Network connection details for a KeyRelay server.
 * <p>
 * A trailing slash on the base URI is dropped so that every endpoint path, which starts with
 * {@code /}, can be appended as is.
 *
 * @param baseUri the server root, for example {@code http://host:8080}
 */
public record ServerConnectionInfo(URI baseUri) {

  public ServerConnectionInfo {
    Objects.requireNonNull(baseUri, "baseUri");
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      baseUri = URI.create(base.substring(0, base.length() - 1));
    }
  }

  /**
   * Endpoint URI for a path relative to the server root.
   *
   * @param path absolute path, already percent-encoded, optionally with a query string
   * @return the endpoint URI
   */
  public URI resolve(String path) {
    return URI.create(baseUri + path);
  }
}
