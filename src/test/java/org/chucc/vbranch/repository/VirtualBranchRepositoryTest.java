package org.chucc.vbranch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.chucc.vbranch.config.VirtualBranchProperties;
import org.chucc.vbranch.domain.Branch;
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.domain.Oid;
import org.chucc.vbranch.domain.Ownership;
import org.chucc.vbranch.exception.BranchLoadException;
import org.chucc.vbranch.exception.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VirtualBranchRepositoryTest {

  private static final Oid TREE = Oid.of("1111111111111111111111111111111111111111");
  private static final Oid HEAD = Oid.of("2222222222222222222222222222222222222222");

  private InMemoryKeyValueStore store;
  private VirtualBranchRepository repository;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyValueStore();
    repository = new VirtualBranchRepository(store, new VirtualBranchProperties());
  }

  private static Branch branch(String name, int order, long created) {
    return new Branch(BranchId.generate(), name, "", false, null, null, created, created,
        TREE, HEAD, new Ownership(), order);
  }

  @Test
  void shouldSaveAndFindBranch() {
    Branch branch = branch("feature", 0, 100L);

    repository.save(branch);

    assertThat(repository.findById(branch.getId())).contains(branch);
    assertThat(repository.exists(branch.getId())).isTrue();
  }

  @Test
  void shouldStoreUnderBranchRoot() {
    Branch branch = branch("feature", 0, 100L);

    repository.save(branch);

    assertThat(store.children("branches")).containsExactly(branch.getId().toString());
    assertThat(store.reader("branches/" + branch.getId()).read("meta/name"))
        .contains(Content.of("feature"));
  }

  @Test
  void shouldReturnEmptyForUnknownBranch() {
    assertThat(repository.findById(BranchId.generate())).isEmpty();
  }

  @Test
  void shouldListByOrderThenCreation() {
    Branch third = branch("c", 1, 50L);
    Branch first = branch("a", 0, 200L);
    Branch second = branch("b", 1, 10L);
    repository.save(third);
    repository.save(first);
    repository.save(second);

    assertThat(repository.findAll()).extracting(Branch::getName).containsExactly("a", "b", "c");
  }

  @Test
  void shouldSkipRecordsNotNamedByBranchId() {
    Branch branch = branch("feature", 0, 100L);
    repository.save(branch);
    store.writer("branches/stray").commit(new WriteBatch().put("id", Content.of("x")));

    assertThat(repository.findAll()).containsExactly(branch);
  }

  @Test
  void shouldDeleteBranch() {
    Branch branch = branch("feature", 0, 100L);
    repository.save(branch);

    assertThat(repository.delete(branch.getId())).isTrue();
    assertThat(repository.exists(branch.getId())).isFalse();
    assertThat(repository.delete(branch.getId())).isFalse();
  }

  @Test
  void shouldReportCorruptRecord() {
    Branch branch = branch("feature", 0, 100L);
    repository.save(branch);
    store.writer("branches/" + branch.getId())
        .commit(new WriteBatch().remove("meta/tree"));

    BranchLoadException e = assertThrows(BranchLoadException.class,
        () -> repository.findById(branch.getId()));

    assertThat(e.getField()).isEqualTo("meta/tree");
  }

  @Test
  void shouldReportRecordMissingItsId() {
    Branch branch = branch("feature", 0, 100L);
    repository.save(branch);
    store.writer("branches/" + branch.getId()).commit(new WriteBatch().remove("id"));

    assertThat(repository.exists(branch.getId())).isTrue();
    BranchLoadException byId = assertThrows(BranchLoadException.class,
        () -> repository.findById(branch.getId()));
    BranchLoadException listing = assertThrows(BranchLoadException.class,
        () -> repository.findAll());

    assertThat(byId.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
    assertThat(byId.getField()).isEqualTo("id");
    assertThat(listing.getField()).isEqualTo("id");
  }

  @Test
  void shouldRejectRecordHoldingAnotherId() {
    Branch branch = branch("feature", 0, 100L);
    BranchId other = BranchId.generate();
    repository.save(branch);
    store.writer("branches/" + branch.getId())
        .commit(new WriteBatch().put("id", Content.of(other.toString())));

    BranchLoadException e = assertThrows(BranchLoadException.class,
        () -> repository.findById(branch.getId()));

    assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID);
    assertThat(e.getField()).isEqualTo("id");
    assertThat(e.getMessage()).contains(other.toString());
    assertThat(store.children("branches")).containsExactly(branch.getId().toString());
  }

  @Test
  void shouldHonourConfiguredRoot() {
    VirtualBranchProperties properties = new VirtualBranchProperties();
    properties.setStoreRoot("project/1/branches");
    VirtualBranchRepository scoped = new VirtualBranchRepository(store, properties);
    Branch branch = branch("feature", 0, 100L);

    scoped.save(branch);

    assertThat(store.children("project/1/branches"))
        .containsExactly(branch.getId().toString());
    assertThat(repository.findAll()).isEmpty();
  }
}
