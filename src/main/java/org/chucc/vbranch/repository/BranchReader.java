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
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.domain.Oid;
import org.chucc.vbranch.domain.RemoteRefname;
import org.chucc.vbranch.exception.BranchLoadException;

/**
 * Reconstructs a {@link Branch} from its stored record.
 * Reading has no side effects beyond the reads themselves.
 */
public final class BranchReader {

  private BranchReader() {
    // Utility class
  }

  /**
   * Loads a branch.
   *
   * @param reader the reader scoped to the branch's record
   * @return the reconstructed branch
   * @throws BranchLoadException if a mandatory field is missing, any field is malformed,
   *     or the update timestamp precedes the creation timestamp, naming the key
   * @throws org.chucc.vbranch.exception.StoreException if the store fails
   */
  public static Branch read(RecordReader reader) {
    BranchId id = ID.load(reader);
    String name = NAME.load(reader);
    String notes = NOTES.load(reader);
    boolean applied = APPLIED.load(reader);
    RemoteRefname upstream = UPSTREAM.load(reader).orElse(null);
    Oid upstreamHead = UPSTREAM_HEAD.load(reader).orElse(null);
    long created = CREATED_TIMESTAMP_MS.load(reader);
    long updated = UPDATED_TIMESTAMP_MS.load(reader);
    if (updated < created) {
      throw BranchLoadException.invalid(UPDATED_TIMESTAMP_MS.getKey(),
          new IllegalArgumentException(
              "Update timestamp " + updated + " precedes creation timestamp " + created));
    }
    return new Branch(id, name, notes, applied, upstream, upstreamHead, created, updated,
        TREE.load(reader),
        HEAD.load(reader),
        OWNERSHIP.load(reader),
        ORDER.load(reader));
  }
}
