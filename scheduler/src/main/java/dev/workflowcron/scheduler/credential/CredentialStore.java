package dev.workflowcron.scheduler.credential;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CredentialStore {

  List<ExecutionCredential> listByProject(UUID projectId);

  Optional<ExecutionCredential> findByHashedSecret(String hashedSecret);

  /**
   * Atomically deactivates every active automation credential of {@code replacement.projectId()}
   * (recording {@link RevocationReason#ROTATION}) and inserts {@code replacement}.
   *
   * @return the inserted credential as persisted
   */
  ExecutionCredential rotate(ExecutionCredential replacement, UUID actorId);

  /** Deactivates every active automation credential of the project and returns how many changed */
  int deactivateAutomation(UUID projectId, UUID actorId, RevocationReason reason);
}
