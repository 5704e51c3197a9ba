package com.scholary.speech.gateway.store;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * Document store held in process memory.
 *
 * <p>A single read-write lock makes every multi-path update atomic with respect to readers.
 * Values should be immutable (records, {@code Instant}); they are stored by reference.
 */
@Repository
public class InMemoryDocumentStore implements DocumentStore {

  private final NavigableMap<String, Object> documents = new TreeMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public <T> Optional<T> get(String path, Class<T> type) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(documents.get(path)).map(type::cast);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<String> childKeys(String path) {
    String prefix = path.endsWith("/") ? path : path + "/";
    TreeSet<String> children = new TreeSet<>();
    lock.readLock().lock();
    try {
      // '0' sorts directly after '/', so this covers every key under the prefix
      String upper = prefix.substring(0, prefix.length() - 1) + "0";
      for (String key : documents.subMap(prefix, true, upper, false).keySet()) {
        String rest = key.substring(prefix.length());
        int slash = rest.indexOf('/');
        String child = slash < 0 ? rest : rest.substring(0, slash);
        children.add(child);
      }
    } finally {
      lock.readLock().unlock();
    }
    return List.copyOf(children);
  }

  @Override
  public void set(String path, Object value) {
    Objects.requireNonNull(value, "value");
    lock.writeLock().lock();
    try {
      documents.put(path, value);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean update(Map<String, Object> writes, List<Precondition> preconditions) {
    writes.values().forEach(value -> Objects.requireNonNull(value, "write value"));
    lock.writeLock().lock();
    try {
      for (Precondition precondition : preconditions) {
        if (!Objects.equals(documents.get(precondition.path()), precondition.expected())) {
          return false;
        }
      }
      documents.putAll(writes);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
