package org.chucc.vbranch.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.chucc.vbranch.config.VirtualBranchProperties;
import org.chucc.vbranch.domain.Branch;
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.domain.FileOwnership;
import org.chucc.vbranch.domain.Oid;
import org.chucc.vbranch.domain.Ownership;
import org.chucc.vbranch.domain.RemoteRefname;
import org.chucc.vbranch.dto.BranchCreateRequest;
import org.chucc.vbranch.dto.BranchUpdateRequest;
import org.chucc.vbranch.exception.BranchLoadException;
import org.chucc.vbranch.exception.VirtualBranchNotFoundException;
import org.chucc.vbranch.repository.BranchRecordSchema;
import org.chucc.vbranch.repository.VirtualBranchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for virtual branch operations.
 * Builds branches from create requests, applies update requests as sparse patches, and
 * keeps hunk claims disjoint across branches.
 *
 * <p>Concurrent updates of the same branch are not arbitrated here; the last stored
 * batch wins. Operations that rewrite several branches store them one batch at a time.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class VirtualBranchService {

  private static final Logger logger = LoggerFactory.getLogger(VirtualBranchService.class);

  private final VirtualBranchRepository repository;
  private final VirtualBranchProperties properties;
  private final Clock clock;

  /**
   * Constructs a VirtualBranchService.
   *
   * @param repository the branch repository
   * @param properties the configuration
   * @param clock the clock for timestamps
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repository, properties and clock are Spring-managed beans")
  public VirtualBranchService(VirtualBranchRepository repository,
                              VirtualBranchProperties properties,
                              Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates and stores a branch.
   * When an order is requested, branches at or after that position move back by one.
   * Hunks claimed by the new branch are released by every other branch.
   *
   * @param request the create request
   * @param baseTree the merge base tree the branch starts from
   * @param baseHead the commit the branch starts from
   * @return the stored branch
   * @throws IllegalArgumentException if the request is invalid
   */
  public Branch create(BranchCreateRequest request, Oid baseTree, Oid baseHead) {
    request.validate();
    List<Branch> existing = repository.findAll();

    String name = request.name() != null ? request.name() : uniqueDefaultName(existing);
    int order = request.order() != null ? request.order() : existing.size();
    Ownership ownership = request.ownership() != null ? request.ownership() : new Ownership();
    long now = clock.millis();

    Branch branch = new Branch(BranchId.generate(), name, "", false, null, null,
        now, now, baseTree, baseHead, ownership, order);
    logger.info("Creating virtual branch {} ({}) at order {}", branch.getId(), name, order);

    if (request.order() != null) {
      shiftOrders(existing, order, now);
    }
    releaseFromOthers(existing, branch.getId(), ownership, now);

    return repository.save(branch);
  }

  /**
   * Applies an update request: null fields are left unchanged and the update timestamp
   * is always refreshed.
   *
   * @param request the update request
   * @return the stored branch
   * @throws VirtualBranchNotFoundException if no branch has the requested id
   * @throws BranchLoadException with field {@code meta/upstream} if the upstream name is
   *     not a valid branch name
   * @throws IllegalArgumentException if the request is otherwise invalid
   */
  public Branch update(BranchUpdateRequest request) {
    request.validate();
    Branch branch = get(request.id());

    if (request.upstream() != null) {
      branch.setUpstream(qualifyUpstream(request.upstream()));
    }
    if (request.name() != null) {
      branch.setName(request.name());
    }
    if (request.notes() != null) {
      branch.setNotes(request.notes());
    }
    if (request.order() != null) {
      branch.setOrder(request.order());
    }
    long now = clock.millis();
    if (request.ownership() != null) {
      releaseFromOthers(repository.findAll(), branch.getId(), request.ownership(), now);
      branch.setOwnership(request.ownership());
    }
    branch.touch(now);

    logger.info("Updating virtual branch {} ({})", branch.getId(), branch.getName());
    return repository.save(branch);
  }

  /**
   * Gets a branch.
   *
   * @param id the branch id
   * @return the branch
   * @throws VirtualBranchNotFoundException if no branch has the id
   */
  public Branch get(BranchId id) {
    return repository.findById(id).orElseThrow(() -> new VirtualBranchNotFoundException(id));
  }

  /**
   * Lists every branch in display order.
   *
   * @return the branches sorted by order, then creation time
   */
  public List<Branch> list() {
    return repository.findAll();
  }

  /**
   * Deletes a branch record.
   *
   * @param id the branch id
   * @throws VirtualBranchNotFoundException if no branch has the id
   */
  public void delete(BranchId id) {
    if (!repository.delete(id)) {
      throw new VirtualBranchNotFoundException(id);
    }
    logger.info("Deleted virtual branch {}", id);
  }

  /**
   * Records whether a branch's ownership is materialized in the working tree.
   *
   * @param id the branch id
   * @param applied the new state
   * @return the stored branch
   * @throws VirtualBranchNotFoundException if no branch has the id
   */
  public Branch setApplied(BranchId id, boolean applied) {
    Branch branch = get(id);
    branch.setApplied(applied);
    branch.touch(clock.millis());
    logger.info("Marking virtual branch {} as {}", id, applied ? "applied" : "unapplied");
    return repository.save(branch);
  }

  /**
   * Moves the ownership of one file from a branch to another.
   *
   * @param from the branch giving up the file
   * @param to the branch receiving it
   * @param path the file path
   * @return the hunks moved, empty if {@code from} did not claim the file
   * @throws VirtualBranchNotFoundException if either branch does not exist
   */
  public FileOwnership moveOwnership(BranchId from, BranchId to, String path) {
    Branch source = get(from);
    Branch target = get(to);
    if (from.equals(to)) {
      return source.getOwnership().get(path).orElseGet(() -> new FileOwnership(path));
    }

    Ownership sourceOwnership = source.getOwnership();
    FileOwnership moved = sourceOwnership.take(path);
    if (moved.isEmpty()) {
      return moved;
    }
    Ownership targetOwnership = target.getOwnership();
    targetOwnership.put(moved);

    long now = clock.millis();
    source.setOwnership(sourceOwnership);
    source.touch(now);
    target.setOwnership(targetOwnership);
    target.touch(now);

    logger.info("Moving {} ({} hunks) from virtual branch {} to {}",
        path, moved.getHunks().size(), from, to);
    repository.save(source);
    repository.save(target);
    return moved;
  }

  private RemoteRefname qualifyUpstream(String shortName) {
    try {
      return RemoteRefname.of(properties.getDefaultRemote(), shortName);
    } catch (IllegalArgumentException e) {
      throw BranchLoadException.invalid(BranchRecordSchema.UPSTREAM.getKey(), e);
    }
  }

  private String uniqueDefaultName(List<Branch> existing) {
    Set<String> names = new HashSet<>();
    existing.forEach(b -> names.add(b.getName()));
    String base = properties.getDefaultBranchName();
    if (!names.contains(base)) {
      return base;
    }
    int suffix = 2;
    while (names.contains(base + " " + suffix)) {
      suffix++;
    }
    return base + " " + suffix;
  }

  private void shiftOrders(List<Branch> existing, int from, long now) {
    for (Branch other : existing) {
      if (other.getOrder() >= from) {
        other.setOrder(other.getOrder() + 1);
        other.touch(now);
        repository.save(other);
      }
    }
  }

  private void releaseFromOthers(List<Branch> existing, BranchId owner, Ownership claim,
                                 long now) {
    if (claim.isEmpty()) {
      return;
    }
    for (Branch other : existing) {
      if (other.getId().equals(owner)) {
        continue;
      }
      Ownership ownership = other.getOwnership();
      boolean changed = false;
      for (FileOwnership file : claim.getFiles()) {
        if (ownership.intersects(file)) {
          FileOwnership released = ownership.release(file);
          logger.debug("Virtual branch {} releases {}", other.getId(), released);
          changed = true;
        }
      }
      if (changed) {
        other.setOwnership(ownership);
        other.touch(now);
        repository.save(other);
      }
    }
  }
}
