package org.chucc.vbranch.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Domain entity representing a virtual branch: a unit of in-progress work that is not a
 * real version-control reference but a record of the hunks assigned to it.
 * Only the record store knows about it; the repository itself never sees it.
 */
public final class Branch {

  private final BranchId id;
  private String name;
  private String notes;
  private boolean applied;
  private RemoteRefname upstream;
  // last commit pushed to the upstream branch
  private Oid upstreamHead;
  private final long createdTimestampMs;
  private long updatedTimestampMs;
  private Oid tree;
  private Oid head;
  private Ownership ownership;
  private int order;

  /**
   * Creates a new Branch with full state.
   *
   * @param id the branch id (must be non-null)
   * @param name the user-facing name (must be non-null, need not be unique)
   * @param notes free text notes (must be non-null)
   * @param applied whether the branch's ownership is materialized in the working tree
   * @param upstream the remote-tracking reference, or null if unset
   * @param upstreamHead the last commit pushed to upstream, or null if never pushed
   * @param createdTimestampMs creation time in milliseconds since epoch (must be >= 0)
   * @param updatedTimestampMs last modification time in milliseconds since epoch (must not
   *     precede createdTimestampMs)
   * @param tree the last tree written for this branch, or the merge base tree if new
   * @param head the latest virtual commit of this branch
   * @param ownership the claimed hunks (copied)
   * @param order display and application order (must be >= 0)
   * @throws IllegalArgumentException if validation fails
   */
  @SuppressWarnings("PMD.ExcessiveParameterList") // mirrors the stored record field for field
  public Branch(BranchId id, String name, String notes, boolean applied,
                RemoteRefname upstream, Oid upstreamHead,
                long createdTimestampMs, long updatedTimestampMs,
                Oid tree, Oid head, Ownership ownership, int order) {
    Objects.requireNonNull(id, "Branch id cannot be null");
    Objects.requireNonNull(name, "Branch name cannot be null");
    Objects.requireNonNull(notes, "Branch notes cannot be null");
    Objects.requireNonNull(tree, "Branch tree cannot be null");
    Objects.requireNonNull(head, "Branch head cannot be null");
    Objects.requireNonNull(ownership, "Branch ownership cannot be null");

    if (createdTimestampMs < 0 || updatedTimestampMs < 0) {
      throw new IllegalArgumentException("Timestamps cannot be negative");
    }
    if (updatedTimestampMs < createdTimestampMs) {
      throw new IllegalArgumentException("Update timestamp " + updatedTimestampMs
          + " precedes creation timestamp " + createdTimestampMs);
    }
    if (order < 0) {
      throw new IllegalArgumentException("Branch order cannot be negative: " + order);
    }

    this.id = id;
    this.name = name;
    this.notes = notes;
    this.applied = applied;
    this.upstream = upstream;
    this.upstreamHead = upstreamHead;
    this.createdTimestampMs = createdTimestampMs;
    this.updatedTimestampMs = updatedTimestampMs;
    this.tree = tree;
    this.head = head;
    this.ownership = ownership.copy();
    this.order = order;
  }

  /**
   * Creates an independent copy of this branch.
   *
   * @return the copy
   */
  public Branch copy() {
    return new Branch(id, name, notes, applied, upstream, upstreamHead,
        createdTimestampMs, updatedTimestampMs, tree, head, ownership, order);
  }

  /**
   * Derives the synthetic reference name of this branch.
   *
   * @return the virtual refname
   */
  public VirtualRefname refname() {
    return VirtualRefname.derive(name, id);
  }

  public BranchId getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "Branch name cannot be null");
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = Objects.requireNonNull(notes, "Branch notes cannot be null");
  }

  public boolean isApplied() {
    return applied;
  }

  public void setApplied(boolean applied) {
    this.applied = applied;
  }

  public Optional<RemoteRefname> getUpstream() {
    return Optional.ofNullable(upstream);
  }

  public void setUpstream(RemoteRefname upstream) {
    this.upstream = upstream;
  }

  public Optional<Oid> getUpstreamHead() {
    return Optional.ofNullable(upstreamHead);
  }

  public void setUpstreamHead(Oid upstreamHead) {
    this.upstreamHead = upstreamHead;
  }

  public long getCreatedTimestampMs() {
    return createdTimestampMs;
  }

  public long getUpdatedTimestampMs() {
    return updatedTimestampMs;
  }

  /**
   * Records a modification. The update timestamp never moves below the creation timestamp.
   *
   * @param nowMs the current time in milliseconds since epoch
   */
  public void touch(long nowMs) {
    this.updatedTimestampMs = Math.max(nowMs, createdTimestampMs);
  }

  public Oid getTree() {
    return tree;
  }

  public void setTree(Oid tree) {
    this.tree = Objects.requireNonNull(tree, "Branch tree cannot be null");
  }

  public Oid getHead() {
    return head;
  }

  public void setHead(Oid head) {
    this.head = Objects.requireNonNull(head, "Branch head cannot be null");
  }

  /**
   * Gets a copy of the claimed hunks. Changes to the copy are applied with
   * {@link #setOwnership(Ownership)}.
   *
   * @return the ownership copy
   */
  public Ownership getOwnership() {
    return ownership.copy();
  }

  public void setOwnership(Ownership ownership) {
    this.ownership = Objects.requireNonNull(ownership, "Branch ownership cannot be null").copy();
  }

  public int getOrder() {
    return order;
  }

  /**
   * Sets the display order.
   *
   * @param order the new order (must be >= 0)
   * @throws IllegalArgumentException if order is negative
   */
  public void setOrder(int order) {
    if (order < 0) {
      throw new IllegalArgumentException("Branch order cannot be negative: " + order);
    }
    this.order = order;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Branch branch = (Branch) obj;
    return id.equals(branch.id)
        && name.equals(branch.name)
        && notes.equals(branch.notes)
        && applied == branch.applied
        && Objects.equals(upstream, branch.upstream)
        && Objects.equals(upstreamHead, branch.upstreamHead)
        && createdTimestampMs == branch.createdTimestampMs
        && updatedTimestampMs == branch.updatedTimestampMs
        && tree.equals(branch.tree)
        && head.equals(branch.head)
        && ownership.equals(branch.ownership)
        && order == branch.order;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, notes, applied, upstream, upstreamHead,
        createdTimestampMs, updatedTimestampMs, tree, head, ownership, order);
  }

  @Override
  public String toString() {
    return "Branch{id=" + id + ", name='" + name + "', applied=" + applied
        + ", order=" + order + ", head=" + head + "}";
  }
}
