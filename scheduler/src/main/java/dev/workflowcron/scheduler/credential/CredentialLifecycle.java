package dev.workflowcron.scheduler.credential;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.exceptions.CredentialException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, rotates and revokes the automation credential of a project. A project has at most one
 * active automation credential; issuing a new one always deactivates the previous one.
 */
public class CredentialLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(CredentialLifecycle.class);

  private final CredentialStore store;
  private final SecretCipher cipher;
  private final String hashingSecret;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public CredentialLifecycle(CredentialStore store, SecretCipher cipher, String hashingSecret) {
    this(store, cipher, hashingSecret, Clock.systemUTC());
  }

  public CredentialLifecycle(
      CredentialStore store, SecretCipher cipher, String hashingSecret, Clock clock) {
    this.store = Objects.requireNonNull(store);
    this.cipher = Objects.requireNonNull(cipher);
    this.hashingSecret = Objects.requireNonNull(hashingSecret);
    this.clock = Objects.requireNonNull(clock);
  }

  public @Nullable ExecutionCredential findActiveAutomationCredential(UUID projectId) {
    var active =
        store.listByProject(projectId).stream()
            .filter(ExecutionCredential::isActiveAutomation)
            .sorted(Comparator.comparing(ExecutionCredential::createdAt).reversed())
            .toList();
    if (active.size() > 1) {
      logger.error(
          "Project {} has {} active automation credentials, using the newest",
          projectId,
          active.size());
    }
    return active.isEmpty() ? null : active.get(0);
  }

  /**
   * Issues a new automation credential for the project, deactivating the current one if there is
   * one. The returned plaintext is also stored encrypted, for {@link #revealSecret}.
   */
  public IssuedCredential issueOrRotate(UUID projectId, UUID actorId) {
    Objects.requireNonNull(projectId, "projectId must not be null");
    Objects.requireNonNull(actorId, "actorId must not be null");

    var token = generateToken();
    var candidate =
        new ExecutionCredential(
            UUID.randomUUID(),
            projectId,
            ExecutionCredential.automationName(UUID.randomUUID()),
            generatePublicKey(),
            hash(token),
            cipher.encrypt(token),
            true,
            true,
            actorId,
            null,
            null,
            clock.instant(),
            null);

    var persisted = store.rotate(candidate, actorId);
    logger.info("Issued automation credential {} for project {}", persisted.publicKey(), projectId);
    return new IssuedCredential(persisted, token);
  }

  public int revokeAll(UUID projectId, UUID actorId) {
    return revokeAll(projectId, actorId, RevocationReason.SCHEDULES_REMOVED);
  }

  /** Deactivates every automation credential of the project; returns 0 if none was active. */
  public int revokeAll(UUID projectId, UUID actorId, RevocationReason reason) {
    var count = store.deactivateAutomation(projectId, actorId, reason);
    if (count > 0) {
      logger.info(
          "Revoked {} automation credential(s) for project {} ({})", count, projectId, reason);
    }
    return count;
  }

  /**
   * Recovers the plaintext of an active automation credential.
   *
   * @throws CredentialException if the credential is inactive or carries no recoverable secret
   */
  public String revealSecret(ExecutionCredential credential) {
    if (!credential.active()) {
      throw new CredentialException(
          credential.projectId(), "Credential %s is not active".formatted(credential.publicKey()));
    }
    if (credential.encryptedSecret() == null) {
      throw new CredentialException(
          credential.projectId(),
          "Credential %s has no recoverable secret".formatted(credential.publicKey()));
    }
    try {
      return cipher.decrypt(credential.encryptedSecret());
    } catch (CredentialException e) {
      throw new CredentialException(credential.projectId(), e.getMessage(), e);
    }
  }

  /** Resolves the active credential a caller presented, if any. */
  public Optional<ExecutionCredential> verify(String token) {
    if (token == null || !token.startsWith(Constants.CREDENTIAL_TOKEN_PREFIX)) {
      return Optional.empty();
    }
    return store.findByHashedSecret(hash(token)).filter(ExecutionCredential::active);
  }

  String hash(String token) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      digest.update(token.getBytes(StandardCharsets.UTF_8));
      digest.update(hashingSecret.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  private String generateToken() {
    byte[] bytes = new byte[Constants.CREDENTIAL_TOKEN_BYTES];
    random.nextBytes(bytes);
    return Constants.CREDENTIAL_TOKEN_PREFIX
        + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private String generatePublicKey() {
    byte[] bytes = new byte[8];
    random.nextBytes(bytes);
    return "pk_" + HexFormat.of().formatHex(bytes);
  }
}
