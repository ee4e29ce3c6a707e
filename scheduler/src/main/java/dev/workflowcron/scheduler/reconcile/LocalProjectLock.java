package dev.workflowcron.scheduler.reconcile;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process project locks, for a single scheduler instance. An entry lives only while some
 * thread holds or waits on its lock.
 */
public class LocalProjectLock implements ProjectLock {

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int users; // guarded by the map's per-key compute
  }

  private final ConcurrentHashMap<UUID, Entry> locks = new ConcurrentHashMap<>();

  @Override
  public Held acquire(UUID projectId) {
    var entry =
        locks.compute(
            projectId,
            (id, current) -> {
              var e = current == null ? new Entry() : current;
              e.users++;
              return e;
            });
    entry.lock.lock();
    return () -> {
      entry.lock.unlock();
      leave(projectId);
    };
  }

  private void leave(UUID projectId) {
    locks.computeIfPresent(projectId, (id, e) -> --e.users == 0 ? null : e);
  }

  int size() {
    return locks.size();
  }
}
