package workerkit.dispatch;

import workerkit.spi.WorkerHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Registry of live workers, owned by one {@link WorkerDispatcher}.
 *
 * <p>Entries are keyed by worker name and kept in launch order. A worker is registered
 * before it is spawned and removed exactly once: when its result arrives, when spawning
 * fails, or when it is killed. Whichever path removes the entry owns the worker's teardown.
 *
 * <p>Inject a fresh instance per dispatcher; instances are never shared implicitly.
 * This class is thread-safe.
 */
public final class WorkerRegistry {
  private final Map<String, Entry> workers = new LinkedHashMap<>();

  /**
   * Registers a worker under {@code name} unless that name is taken.
   *
   * @return the new entry, or {@code null} if a live worker already has this name
   */
  synchronized Entry tryRegister(String name) {
    Objects.requireNonNull(name, "name");
    if (workers.containsKey(name)) {
      return null;
    }
    Entry entry = new Entry(name);
    workers.put(name, entry);
    return entry;
  }

  synchronized boolean remove(Entry entry) {
    boolean removed = workers.remove(entry.name, entry);
    if (removed) {
      notifyAll();
    }
    return removed;
  }

  synchronized List<Entry> removeAll() {
    List<Entry> removed = new ArrayList<>(workers.values());
    workers.clear();
    notifyAll();
    return removed;
  }

  /**
   * Waits until no worker is registered.
   *
   * @param timeoutMs maximum time to wait in milliseconds
   * @return {@code true} if the registry emptied in time
   * @throws InterruptedException if interrupted while waiting
   */
  public synchronized boolean awaitEmpty(long timeoutMs) throws InterruptedException {
    long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (!workers.isEmpty()) {
      if (remainingNanos <= 0) {
        return false;
      }
      long start = System.nanoTime();
      TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
      remainingNanos -= System.nanoTime() - start;
    }
    return true;
  }

  /**
   * Passes the current size to {@code sink} while holding the registry monitor, so that
   * concurrent reports reach the sink in mutation order.
   *
   * @param sink receives the number of live workers
   */
  synchronized void reportSize(IntConsumer sink) {
    sink.accept(workers.size());
  }

  public synchronized int size() {
    return workers.size();
  }

  /**
   * Returns the names of live workers in launch order.
   *
   * @return an immutable snapshot of worker names
   */
  public synchronized List<String> names() {
    return List.copyOf(workers.keySet());
  }

  /**
   * Registry slot for one worker. The platform handle is attached after spawning; if the
   * worker already finished by then, the late handle is terminated on attach.
   */
  static final class Entry {
    private final String name;
    private final long startedNanos = System.nanoTime();
    private WorkerHandle handle;
    private boolean released;

    private Entry(String name) {
      this.name = name;
    }

    String name() {
      return name;
    }

    long elapsedMs() {
      return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    void attach(WorkerHandle workerHandle) {
      boolean terminateNow;
      synchronized (this) {
        handle = workerHandle;
        terminateNow = released;
      }
      if (terminateNow) {
        workerHandle.terminate();
      }
    }

    void terminate() {
      WorkerHandle current;
      synchronized (this) {
        released = true;
        current = handle;
      }
      if (current != null) {
        current.terminate();
      }
    }
  }
}
