package com.scholary.speech.gateway.api;

/** Identity headers set by the authentication layer in front of the gateway. */
final class CallerHeaders {

  static final String USER_ID = "X-User-Id";
  static final String ROLE = "X-User-Role";
  static final String RESET_TOKEN = "X-Reset-Token";

  /** Requests without an identity are billed to a shared anonymous normal user. */
  static final String ANONYMOUS = "anonymous";

  private CallerHeaders() {}
}
