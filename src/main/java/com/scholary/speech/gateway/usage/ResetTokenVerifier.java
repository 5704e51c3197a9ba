package com.scholary.speech.gateway.usage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.stereotype.Component;

/** Checks the shared token presented by the external reset scheduler and by operators. */
@Component
public class ResetTokenVerifier {

  private final String token;

  public ResetTokenVerifier(UsageProperties properties) {
    this.token = properties.reset().token();
  }

  /** Constant-time comparison. Always false while no token is configured. */
  public boolean matches(String presented) {
    if (token == null || token.isBlank() || presented == null) {
      return false;
    }
    return MessageDigest.isEqual(
        token.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
  }
}
