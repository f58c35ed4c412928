package ca.gc.cra.bridge.application.pipeline;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * <strong>What:</strong> Bounded, insertion-ordered set of recently replicated message identifiers.
 * <p><strong>Why:</strong> Suppresses redeliveries seen within the recent window without unbounded
 * memory growth. It is approximate by construction: identifiers evicted from the window are no
 * longer recognized.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer membership in O(1).</li>
 *   <li>When full, evict the oldest {@code evictionBatch} identifiers (insertion order, not access
 *   order) before inserting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the supervisor thread.</p>
 * <p><strong>Performance:</strong> Eviction walks {@code evictionBatch} entries, amortized O(1) per insert.</p>
 *
 * @since 0.1.0
 */
public final class DeduplicationWindow {
  /** Default maximum number of identifiers retained. */
  public static final int DEFAULT_CAPACITY = 10_000;
  /** Default number of identifiers evicted when the window is full. */
  public static final int DEFAULT_EVICTION_BATCH = 1_000;

  private final int capacity;
  private final int evictionBatch;
  private final LinkedHashSet<String> ids;

  /** Creates a window with the default capacity and eviction batch. */
  public DeduplicationWindow() {
    this(DEFAULT_CAPACITY, DEFAULT_EVICTION_BATCH);
  }

  /**
   * Creates a window.
   *
   * @param capacity maximum number of identifiers; must be positive
   * @param evictionBatch identifiers evicted at once when full; in {@code [1, capacity]}
   */
  public DeduplicationWindow(int capacity, int evictionBatch) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    if (evictionBatch <= 0 || evictionBatch > capacity) {
      throw new IllegalArgumentException("evictionBatch must be between 1 and capacity");
    }
    this.capacity = capacity;
    this.evictionBatch = evictionBatch;
    this.ids = new LinkedHashSet<>(Math.min(capacity, 1 << 14));
  }

  /**
   * Checks whether an identifier is currently in the window.
   *
   * @param id deduplication identifier
   * @return {@code true} when seen and not yet evicted
   */
  public boolean contains(String id) {
    return ids.contains(id);
  }

  /**
   * Records an identifier, evicting the oldest batch first when the window is full.
   *
   * @param id deduplication identifier
   * @return {@code false} when the identifier was already present
   */
  public boolean record(String id) {
    Objects.requireNonNull(id, "id");
    if (ids.contains(id)) {
      return false;
    }
    if (ids.size() >= capacity) {
      evictOldest();
    }
    ids.add(id);
    return true;
  }

  /** Forgets every identifier. */
  public void clear() {
    ids.clear();
  }

  public int size() {
    return ids.size();
  }

  public int capacity() {
    return capacity;
  }

  private void evictOldest() {
    Iterator<String> iterator = ids.iterator();
    for (int i = 0; i < evictionBatch && iterator.hasNext(); i++) {
      iterator.next();
      iterator.remove();
    }
  }
}
