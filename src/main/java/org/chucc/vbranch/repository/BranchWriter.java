package org.chucc.vbranch.repository;

import static org.chucc.vbranch.repository.BranchRecordSchema.APPLIED;
import static org.chucc.vbranch.repository.BranchRecordSchema.CREATED_TIMESTAMP_MS;
import static org.chucc.vbranch.repository.BranchRecordSchema.HEAD;
import static org.chucc.vbranch.repository.BranchRecordSchema.ID;
import static org.chucc.vbranch.repository.BranchRecordSchema.NAME;
import static org.chucc.vbranch.repository.BranchRecordSchema.NOTES;
import static org.chucc.vbranch.repository.BranchRecordSchema.ORDER;
import static org.chucc.vbranch.repository.BranchRecordSchema.OWNERSHIP;
import static org.chucc.vbranch.repository.BranchRecordSchema.TREE;
import static org.chucc.vbranch.repository.BranchRecordSchema.UPDATED_TIMESTAMP_MS;
import static org.chucc.vbranch.repository.BranchRecordSchema.UPSTREAM;
import static org.chucc.vbranch.repository.BranchRecordSchema.UPSTREAM_HEAD;

import org.chucc.vbranch.domain.Branch;
import org.chucc.vbranch.exception.StoreException;

/**
 * Persists a {@link Branch} under the keys of {@link BranchRecordSchema}, using the exact
 * inverse of the encodings {@link BranchReader} accepts.
 * All keys are written in one batch; the branch itself is never modified.
 */
public final class BranchWriter {

  private BranchWriter() {
    // Utility class
  }

  /**
   * Builds the batch that stores a branch. Unset upstream fields remove their keys.
   *
   * @param branch the branch
   * @return the batch
   */
  public static WriteBatch toBatch(Branch branch) {
    WriteBatch batch = new WriteBatch();
    ID.store(batch, Content.of(branch.getId().toString()));
    NAME.store(batch, Content.of(branch.getName()));
    NOTES.store(batch, Content.of(branch.getNotes()));
    APPLIED.store(batch, Content.of(branch.isApplied()));
    ORDER.store(batch, Content.of(branch.getOrder()));
    UPSTREAM_HEAD.store(batch, branch.getUpstreamHead()
        .map(oid -> Content.of(oid.toString())).orElse(null));
    UPSTREAM.store(batch, branch.getUpstream()
        .map(ref -> Content.of(ref.toString())).orElse(null));
    TREE.store(batch, Content.of(branch.getTree().toString()));
    HEAD.store(batch, Content.of(branch.getHead().toString()));
    CREATED_TIMESTAMP_MS.store(batch, Content.of(branch.getCreatedTimestampMs()));
    UPDATED_TIMESTAMP_MS.store(batch, Content.of(branch.getUpdatedTimestampMs()));
    OWNERSHIP.store(batch, Content.of(branch.getOwnership().toString()));
    return batch;
  }

  /**
   * Stores a branch.
   *
   * @param writer the writer scoped to the branch's record
   * @param branch the branch
   * @throws StoreException if the store fails; the batch is then not applied
   */
  public static void write(RecordWriter writer, Branch branch) {
    WriteBatch batch = toBatch(branch);
    try {
      writer.commit(batch);
    } catch (StoreException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreException("Failed to write branch " + branch.getId(), e);
    }
  }
}
