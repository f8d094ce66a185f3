package org.chucc.vbranch.repository;

import java.util.Optional;
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.domain.Oid;
import org.chucc.vbranch.domain.Ownership;
import org.chucc.vbranch.domain.RemoteRefname;

/**
 * Key layout of a stored virtual branch record and the load policy of every field.
 *
 * <p>Adding a field means adding one declaration here; older records that lack it load
 * with the field's default as long as it is not required.
 */
public final class BranchRecordSchema {

  public static final RecordField<BranchId> ID =
      RecordField.required("id", c -> BranchId.parse(c.asText()));

  public static final RecordField<String> NAME =
      RecordField.required("meta/name", Content::asText);

  public static final RecordField<String> NOTES =
      RecordField.defaulted("meta/notes", "", Content::asText);

  public static final RecordField<Boolean> APPLIED =
      RecordField.lenient("meta/applied", Boolean.FALSE, Content::asBoolean);

  public static final RecordField<Integer> ORDER =
      RecordField.defaulted("meta/order", 0, Content::asUnsignedInt);

  public static final RecordField<Optional<Oid>> UPSTREAM_HEAD =
      RecordField.optionalText("meta/upstream_head", text -> Optional.of(Oid.of(text)));

  // an empty upstream means unset rather than malformed
  public static final RecordField<Optional<RemoteRefname>> UPSTREAM =
      RecordField.optionalText("meta/upstream",
          text -> text.isEmpty() ? Optional.empty() : Optional.of(RemoteRefname.parse(text)));

  public static final RecordField<Oid> TREE =
      RecordField.required("meta/tree", c -> Oid.of(c.asText()));

  public static final RecordField<Oid> HEAD =
      RecordField.required("meta/head", c -> Oid.of(c.asText()));

  public static final RecordField<Long> CREATED_TIMESTAMP_MS =
      RecordField.required("meta/created_timestamp_ms", Content::asUnsignedLong);

  public static final RecordField<Long> UPDATED_TIMESTAMP_MS =
      RecordField.required("meta/updated_timestamp_ms", Content::asUnsignedLong);

  public static final RecordField<Ownership> OWNERSHIP =
      RecordField.required("meta/ownership", c -> Ownership.parse(c.asText()));

  private BranchRecordSchema() {
    // Constants class
  }
}
