package com.codeheadsystems.lockr.server.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link EntryStore}, partitioned by owner.
 * <p>
 * Batch writes for one owner are applied under that owner's partition monitor, so a concurrent
 * batch for the same owner never interleaves with it. All data is lost on restart.
 */
public class InMemoryEntryStore implements EntryStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEntryStore.class);

  private static final Comparator<VaultEntry> OLDEST_FIRST =
      Comparator.comparing(VaultEntry::createdAt).thenComparing(VaultEntry::id);
  private static final Comparator<VaultEntry> LATEST_WRITE =
      Comparator.comparing(VaultEntry::updatedAt).thenComparing(VaultEntry::id);

  private final ConcurrentHashMap<String, Map<String, VaultEntry>> byOwner = new ConcurrentHashMap<>();

  /**
   * Instantiates a new in-memory entry store.
   */
  public InMemoryEntryStore() {
    log.warn("InMemoryEntryStore in use: vault entries will not survive a restart");
  }

  private Map<String, VaultEntry> partition(String ownerId) {
    return byOwner.computeIfAbsent(ownerId, k -> new ConcurrentHashMap<>());
  }

  @Override
  public List<VaultEntry> findAllByOwner(String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    if (entries == null) {
      return List.of();
    }
    List<VaultEntry> result = new ArrayList<>(entries.values());
    result.sort(OLDEST_FIRST);
    return result;
  }

  @Override
  public Optional<VaultEntry> findLatestByOwner(String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    if (entries == null) {
      return Optional.empty();
    }
    return entries.values().stream().max(LATEST_WRITE);
  }

  @Override
  public Optional<VaultEntry> findByIdAndOwner(String id, String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
  }

  @Override
  public void insert(VaultEntry entry) {
    VaultEntry existing = partition(entry.ownerId()).putIfAbsent(entry.id(), entry);
    if (existing != null) {
      throw new IllegalStateException("Duplicate entry id");
    }
    log.debug("insert(owner={}, id={})", entry.ownerId(), entry.id());
  }

  @Override
  public boolean replace(VaultEntry entry) {
    Map<String, VaultEntry> entries = byOwner.get(entry.ownerId());
    return entries != null && entries.computeIfPresent(entry.id(), (k, old) -> entry) != null;
  }

  @Override
  public List<String> replaceAll(String ownerId, List<VaultEntry> replacements) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    if (entries == null) {
      return List.of();
    }
    List<String> replaced = new ArrayList<>(replacements.size());
    synchronized (entries) {
      for (VaultEntry entry : replacements) {
        if (!ownerId.equals(entry.ownerId())) {
          throw new IllegalArgumentException("Batch contains an entry for another owner");
        }
        if (entries.computeIfPresent(entry.id(), (k, old) -> entry) != null) {
          replaced.add(entry.id());
        }
      }
    }
    log.debug("replaceAll(owner={}) replaced {}/{}", ownerId, replaced.size(), replacements.size());
    return replaced;
  }

  @Override
  public boolean delete(String id, String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    return entries != null && entries.remove(id) != null;
  }

  @Override
  public int deleteAllByOwner(String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    if (entries == null) {
      return 0;
    }
    int deleted = 0;
    synchronized (entries) {
      for (String id : new ArrayList<>(entries.keySet())) {
        if (entries.remove(id) != null) {
          deleted++;
        }
      }
    }
    log.debug("deleteAllByOwner(owner={}) deleted {}", ownerId, deleted);
    return deleted;
  }

  @Override
  public int countByOwner(String ownerId) {
    Map<String, VaultEntry> entries = byOwner.get(ownerId);
    return entries == null ? 0 : entries.size();
  }
}
