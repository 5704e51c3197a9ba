package com.scholary.speech.gateway.access;

/**
 * A request to use a model, created per chunk or per call.
 *
 * @param requestedModel the identifier the client sent, possibly deprecated or blank
 * @param role the caller's role
 * @param sessionId the session the request belongs to, used for log correlation
 * @param userId the account the usage is charged to
 * @param serviceType what the model will be used for
 */
public record ModelRequest(
    String requestedModel, Role role, String sessionId, String userId, ServiceType serviceType) {

  public static ModelRequest transcription(
      String requestedModel, Role role, String sessionId, String userId) {
    return new ModelRequest(requestedModel, role, sessionId, userId, ServiceType.TRANSCRIPTION);
  }
}
