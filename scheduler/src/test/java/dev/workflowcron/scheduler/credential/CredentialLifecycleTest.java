package dev.workflowcron.scheduler.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.exceptions.CredentialException;
import dev.workflowcron.scheduler.utils.InMemoryCredentialStore;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialLifecycleTest {

  InMemoryCredentialStore store;
  CredentialLifecycle lifecycle;
  UUID projectId;

  @BeforeEach
  void beforeEach() {
    store = new InMemoryCredentialStore();
    lifecycle =
        new CredentialLifecycle(store, new SecretCipher(SecretCipher.generateKey()), "pepper");
    projectId = UUID.randomUUID();
  }

  @Test
  void issuesAutomationCredential() {
    var issued = lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    var credential = issued.credential();

    assertTrue(issued.plaintextSecret().startsWith("wfc_"));
    // 24 random bytes in unpadded url safe base64
    assertEquals(4 + 32, issued.plaintextSecret().length());
    assertTrue(credential.name().startsWith("automation_schedule_"));
    assertTrue(credential.automation());
    assertTrue(credential.active());
    assertTrue(credential.publicKey().startsWith("pk_"));
    assertEquals(Constants.SYSTEM_USER_ID, credential.creatorUserId());
    assertEquals(lifecycle.hash(issued.plaintextSecret()), credential.hashedSecret());
    assertNotEquals(issued.plaintextSecret(), credential.encryptedSecret());
    assertFalse(issued.toString().contains(issued.plaintextSecret()));
  }

  @Test
  void rotationKeepsOneActive() {
    UUID last = null;
    for (int i = 0; i < 5; i++) {
      last = lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID).credential().id();
      assertEquals(1, store.activeCount(projectId));
    }
    assertEquals(last, lifecycle.findActiveAutomationCredential(projectId).id());

    var revoked = store.listByProject(projectId).stream().filter(c -> !c.active()).toList();
    assertEquals(4, revoked.size());
    revoked.forEach(c -> assertEquals(RevocationReason.ROTATION, c.revocationReason()));
  }

  @Test
  void revokeAllIsIdempotent() {
    lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);

    assertEquals(1, lifecycle.revokeAll(projectId, Constants.SYSTEM_USER_ID));
    assertEquals(0, lifecycle.revokeAll(projectId, Constants.SYSTEM_USER_ID));
    assertNull(lifecycle.findActiveAutomationCredential(projectId));

    var credential = store.listByProject(projectId).get(0);
    assertEquals(RevocationReason.SCHEDULES_REMOVED, credential.revocationReason());
    assertEquals(Constants.SYSTEM_USER_ID, credential.revokerUserId());
  }

  @Test
  void revokeAllRecordsReason() {
    lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    lifecycle.revokeAll(projectId, Constants.SYSTEM_USER_ID, RevocationReason.PROJECT_DELETED);
    assertEquals(
        RevocationReason.PROJECT_DELETED, store.listByProject(projectId).get(0).revocationReason());
  }

  @Test
  void revealReturnsIssuedSecret() {
    var issued = lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    var active = lifecycle.findActiveAutomationCredential(projectId);
    assertEquals(issued.plaintextSecret(), lifecycle.revealSecret(active));
  }

  @Test
  void revealRefusesInactiveCredential() {
    lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    lifecycle.revokeAll(projectId, Constants.SYSTEM_USER_ID);
    var inactive = store.listByProject(projectId).get(0);

    var e = assertThrows(CredentialException.class, () -> lifecycle.revealSecret(inactive));
    assertEquals(projectId, e.projectId());
  }

  @Test
  void verifyResolvesActiveTokensOnly() {
    var first = lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    assertEquals(
        first.credential().id(), lifecycle.verify(first.plaintextSecret()).orElseThrow().id());

    var second = lifecycle.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
    assertTrue(lifecycle.verify(first.plaintextSecret()).isEmpty());
    assertTrue(lifecycle.verify(second.plaintextSecret()).isPresent());
    assertTrue(lifecycle.verify("wfc_unknown").isEmpty());
    assertTrue(lifecycle.verify("sk_other").isEmpty());
    assertTrue(lifecycle.verify(null).isEmpty());
  }

  @Test
  void hashDependsOnSecret() {
    var other =
        new CredentialLifecycle(store, new SecretCipher(SecretCipher.generateKey()), "salt");
    assertNotEquals(lifecycle.hash("wfc_token"), other.hash("wfc_token"));
    assertEquals(64, lifecycle.hash("wfc_token").length());
  }
}
