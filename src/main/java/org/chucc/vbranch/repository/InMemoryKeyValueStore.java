package org.chucc.vbranch.repository;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory key/value store.
 * Keys are kept sorted so roots can be scanned by prefix. Batches are applied under a
 * write lock, so a reader observes either none or all of a batch.
 */
@Repository
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private final NavigableMap<String, Content> entries = new ConcurrentSkipListMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public RecordReader reader(String root) {
    String prefix = prefixOf(root);
    return key -> {
      lock.readLock().lock();
      try {
        return Optional.ofNullable(entries.get(prefix + key));
      } finally {
        lock.readLock().unlock();
      }
    };
  }

  @Override
  public RecordWriter writer(String root) {
    String prefix = prefixOf(root);
    return batch -> {
      lock.writeLock().lock();
      try {
        for (WriteBatch.Operation op : batch.getOperations()) {
          if (op.isRemoval()) {
            entries.remove(prefix + op.key());
          } else {
            entries.put(prefix + op.key(), op.content());
          }
        }
      } finally {
        lock.writeLock().unlock();
      }
      logger.debug("Committed {} operations under {}", batch.getOperations().size(), root);
    };
  }

  @Override
  public List<String> children(String root) {
    String prefix = prefixOf(root);
    Set<String> names = new TreeSet<>();
    lock.readLock().lock();
    try {
      for (String key : entries.tailMap(prefix, true).keySet()) {
        if (!key.startsWith(prefix)) {
          break;
        }
        String rest = key.substring(prefix.length());
        int slash = rest.indexOf('/');
        names.add(slash < 0 ? rest : rest.substring(0, slash));
      }
    } finally {
      lock.readLock().unlock();
    }
    return new ArrayList<>(names);
  }

  @Override
  public boolean deleteAll(String root) {
    String prefix = prefixOf(root);
    lock.writeLock().lock();
    try {
      boolean any = false;
      Iterator<String> it = entries.tailMap(prefix, true).keySet().iterator();
      while (it.hasNext() && it.next().startsWith(prefix)) {
        it.remove();
        any = true;
      }
      return any;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private static String prefixOf(String root) {
    Objects.requireNonNull(root, "Root cannot be null");
    return root.isEmpty() ? "" : root + "/";
  }
}
