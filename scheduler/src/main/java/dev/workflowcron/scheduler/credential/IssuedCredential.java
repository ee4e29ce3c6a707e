package dev.workflowcron.scheduler.credential;

/** A freshly issued credential together with the only copy of its plaintext handed out. */
public record IssuedCredential(ExecutionCredential credential, String plaintextSecret) {
  @Override
  public String toString() {
    return "IssuedCredential[credential=%s, plaintextSecret=***]".formatted(credential);
  }
}
