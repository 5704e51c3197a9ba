package com.scholary.speech.gateway.store;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hierarchical key-value store addressed by slash-separated paths.
 *
 * <p>The one operation that matters is {@link #update}: a multi-path write that is applied
 * completely or not at all, guarded by preconditions on current values. Any durable store that
 * offers the same contract can replace the in-memory implementation.
 */
public interface DocumentStore {

  /**
   * Read the value at a path.
   *
   * @throws ClassCastException if the stored value is not of the requested type
   * @throws StoreException if the store can't be read
   */
  <T> Optional<T> get(String path, Class<T> type);

  /** Direct children of a path, e.g. the user ids under {@code users}. Sorted. */
  List<String> childKeys(String path);

  /** Unconditionally write a single path. */
  void set(String path, Object value);

  /**
   * Atomically apply several writes if every precondition holds.
   *
   * <p>Readers observe either none or all of the writes.
   *
   * @param writes path to new value; values must not be null
   * @param preconditions values that must be current for the update to apply
   * @return false if a precondition didn't hold, in which case nothing was written
   * @throws StoreException if the store failed; nothing was written
   */
  boolean update(Map<String, Object> writes, List<Precondition> preconditions);

  /**
   * Expected current value of a path; {@code expected == null} means the path must be absent.
   */
  record Precondition(String path, Object expected) {

    public Precondition {
      Objects.requireNonNull(path, "path");
    }

    public static Precondition absent(String path) {
      return new Precondition(path, null);
    }
  }
}
