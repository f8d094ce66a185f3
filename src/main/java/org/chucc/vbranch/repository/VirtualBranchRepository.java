package org.chucc.vbranch.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.chucc.vbranch.config.VirtualBranchProperties;
import org.chucc.vbranch.domain.Branch;
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.exception.BranchLoadException;
import org.chucc.vbranch.exception.MalformedIdentifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Repository for virtual branch records.
 * Each branch lives under {@code <storeRoot>/<branchId>/} in the key/value store.
 */
@Repository
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class VirtualBranchRepository {

  private static final Logger logger = LoggerFactory.getLogger(VirtualBranchRepository.class);

  private final KeyValueStore store;
  private final VirtualBranchProperties properties;

  /**
   * Constructs a VirtualBranchRepository.
   *
   * @param store the key/value store
   * @param properties the configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Store and properties are Spring-managed beans and are intentionally shared")
  public VirtualBranchRepository(KeyValueStore store, VirtualBranchProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  /**
   * Finds a branch by id.
   * A record that exists under the id's root is always loaded, so a missing or foreign
   * {@code id} key is reported rather than hidden.
   *
   * @param id the branch id
   * @return an Optional containing the branch if stored, empty otherwise
   * @throws BranchLoadException if the record is corrupt or its stored id differs from
   *     the id it is stored under
   */
  public Optional<Branch> findById(BranchId id) {
    if (!exists(id)) {
      return Optional.empty();
    }
    return Optional.of(load(id));
  }

  /**
   * Finds all branches, sorted by order and then by creation time.
   *
   * @return the branches
   * @throws BranchLoadException if any record is corrupt
   */
  public List<Branch> findAll() {
    List<Branch> branches = new ArrayList<>();
    for (String child : store.children(properties.getStoreRoot())) {
      BranchId id;
      try {
        id = BranchId.parse(child);
      } catch (MalformedIdentifierException e) {
        logger.warn("Skipping record {} below {}: not a branch id", child,
            properties.getStoreRoot());
        continue;
      }
      branches.add(load(id));
    }
    branches.sort(Comparator.comparingInt(Branch::getOrder)
        .thenComparingLong(Branch::getCreatedTimestampMs));
    return branches;
  }

  /**
   * Saves or updates a branch.
   *
   * @param branch the branch to save
   * @return the saved branch
   * @throws org.chucc.vbranch.exception.StoreException if the store fails
   */
  public Branch save(Branch branch) {
    BranchWriter.write(store.writer(recordRoot(branch.getId())), branch);
    logger.debug("Stored branch {} ({})", branch.getId(), branch.getName());
    return branch;
  }

  /**
   * Deletes a branch record.
   *
   * @param id the branch id
   * @return true if the branch was deleted, false if it didn't exist
   */
  public boolean delete(BranchId id) {
    return store.deleteAll(recordRoot(id));
  }

  /**
   * Checks if a branch record exists.
   *
   * @param id the branch id
   * @return true if any key is stored under the branch's record root
   */
  public boolean exists(BranchId id) {
    return store.children(properties.getStoreRoot()).contains(id.toString());
  }

  private Branch load(BranchId id) {
    Branch branch = BranchReader.read(store.reader(recordRoot(id)));
    if (!branch.getId().equals(id)) {
      throw BranchLoadException.invalid(BranchRecordSchema.ID.getKey(),
          new IllegalArgumentException(
              "Record stored under " + id + " holds id " + branch.getId()));
    }
    return branch;
  }

  private String recordRoot(BranchId id) {
    return properties.getStoreRoot() + "/" + id;
  }
}
