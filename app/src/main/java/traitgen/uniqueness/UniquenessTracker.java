package traitgen.uniqueness;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.model.Assignment;
import traitgen.core.model.UniquenessConfig;
import traitgen.core.model.UniquenessGroup;
import traitgen.index.CombinationIndexer;
import traitgen.index.CombinationKey;

/**
 * Remembers which cross-layer combinations one run has already produced, per uniqueness group.
 *
 * <p>Owned by a single generation run and cleared when the next run starts; never shared between
 * workers or persisted.
 */
public final class UniquenessTracker {
  private static final Logger LOG = LoggerFactory.getLogger(UniquenessTracker.class);

  private final UniquenessConfig config;
  private final Map<String, Set<Long>> usedByGroup = new HashMap<>();
  private long hashedKeys;

  public UniquenessTracker(UniquenessConfig config) {
    this.config = config == null ? UniquenessConfig.disabled() : config;
  }

  /**
   * Passes when the group is inactive, when the assignment does not cover every layer of the group,
   * or when the group's sorted trait-id tuple has not been committed yet.
   */
  public boolean check(UniquenessGroup group, Assignment assignment) {
    CombinationKey key = keyFor(group, assignment);
    if (key == null) {
      return true;
    }
    Set<Long> used = usedByGroup.get(group.id());
    return used == null || !used.contains(key.value());
  }

  /** Checks every active group of the run configuration. */
  public boolean checkAll(Assignment assignment) {
    for (UniquenessGroup group : config.activeGroups()) {
      if (!check(group, assignment)) {
        return false;
      }
    }
    return true;
  }

  /** Records the group's combination; returns false when it was already present. */
  public boolean commit(UniquenessGroup group, Assignment assignment) {
    CombinationKey key = keyFor(group, assignment);
    if (key == null) {
      return true;
    }
    boolean added = usedByGroup.computeIfAbsent(group.id(), id -> new HashSet<>()).add(key.value());
    if (added && !key.exact()) {
      hashedKeys++;
      LOG.debug("Group {} stored hashed key {}", group.id(), key);
    }
    return added;
  }

  /** Commits the assignment into every active group once it has been fully accepted. */
  public void commitAll(Assignment assignment) {
    Objects.requireNonNull(assignment, "assignment");
    for (UniquenessGroup group : config.activeGroups()) {
      commit(group, assignment);
    }
  }

  public void clear() {
    usedByGroup.clear();
    hashedKeys = 0;
  }

  public int size(String groupId) {
    Set<Long> used = usedByGroup.get(groupId);
    return used == null ? 0 : used.size();
  }

  /** Number of committed keys that went through the approximate hashed path. */
  public long hashedKeyCount() {
    return hashedKeys;
  }

  private CombinationKey keyFor(UniquenessGroup group, Assignment assignment) {
    if (group == null || !group.active() || !config.enabled()) {
      return null;
    }
    List<String> layerIds = group.layerIds();
    if (layerIds.isEmpty()) {
      return null;
    }
    int[] traitIds = assignment.traitIds(layerIds);
    if (traitIds == null) {
      return null;
    }
    return CombinationIndexer.key(traitIds);
  }
}
