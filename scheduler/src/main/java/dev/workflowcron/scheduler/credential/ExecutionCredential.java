package dev.workflowcron.scheduler.credential;

import dev.workflowcron.scheduler.Constants;

import java.time.Instant;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A project scoped secret that lets scheduled runs call the workflow execution endpoint. Automation
 * credentials keep their secret encrypted (not only hashed) because the dispatcher has to present
 * the plaintext.
 */
public record ExecutionCredential(
    UUID id,
    UUID projectId,
    String name,
    String publicKey,
    String hashedSecret,
    @Nullable String encryptedSecret,
    boolean active,
    boolean automation,
    UUID creatorUserId,
    @Nullable UUID revokerUserId,
    @Nullable RevocationReason revocationReason,
    Instant createdAt,
    @Nullable Instant revokedAt) {

  public static String automationName(UUID nonce) {
    return Constants.AUTOMATION_CREDENTIAL_PREFIX + nonce;
  }

  /** True for active credentials issued by the scheduler itself */
  public boolean isActiveAutomation() {
    return active && automation && name.startsWith(Constants.AUTOMATION_CREDENTIAL_PREFIX);
  }

  @Override
  public String toString() {
    return ("ExecutionCredential[id=%s, projectId=%s, name=%s, publicKey=%s, active=%s,"
            + " automation=%s, revocationReason=%s]")
        .formatted(id, projectId, name, publicKey, active, automation, revocationReason);
  }
}
