package org.chucc.vbranch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
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
import org.chucc.vbranch.exception.ErrorKind;
import org.chucc.vbranch.exception.VirtualBranchNotFoundException;
import org.chucc.vbranch.repository.InMemoryKeyValueStore;
import org.chucc.vbranch.repository.VirtualBranchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VirtualBranchService against the in-memory store.
 */
class VirtualBranchServiceTest {

  private static final Oid TREE = Oid.of("1111111111111111111111111111111111111111");
  private static final Oid HEAD = Oid.of("2222222222222222222222222222222222222222");

  private TickingClock clock;
  private VirtualBranchProperties properties;
  private VirtualBranchRepository repository;
  private VirtualBranchService service;

  @BeforeEach
  void setUp() {
    clock = new TickingClock(1_700_000_000_000L);
    properties = new VirtualBranchProperties();
    repository = new VirtualBranchRepository(new InMemoryKeyValueStore(), properties);
    service = new VirtualBranchService(repository, properties, clock);
  }

  private Branch create(String name) {
    return service.create(new BranchCreateRequest(name, null, null), TREE, HEAD);
  }

  private static BranchUpdateRequest patch(BranchId id) {
    return new BranchUpdateRequest(id, null, null, null, null, null);
  }

  @Test
  void createShouldFillDefaults() {
    Branch branch = service.create(BranchCreateRequest.empty(), TREE, HEAD);

    assertThat(branch.getName()).isEqualTo("Virtual branch");
    assertThat(branch.getNotes()).isEmpty();
    assertThat(branch.isApplied()).isFalse();
    assertThat(branch.getOrder()).isZero();
    assertThat(branch.getUpstream()).isEmpty();
    assertThat(branch.getUpstreamHead()).isEmpty();
    assertThat(branch.getOwnership().isEmpty()).isTrue();
    assertThat(branch.getTree()).isEqualTo(TREE);
    assertThat(branch.getHead()).isEqualTo(HEAD);
    assertThat(branch.getCreatedTimestampMs()).isEqualTo(1_700_000_000_000L);
    assertThat(branch.getUpdatedTimestampMs()).isEqualTo(branch.getCreatedTimestampMs());
    assertThat(service.get(branch.getId())).isEqualTo(branch);
  }

  @Test
  void createShouldMakeDefaultNamesUnique() {
    service.create(BranchCreateRequest.empty(), TREE, HEAD);
    service.create(BranchCreateRequest.empty(), TREE, HEAD);
    Branch third = service.create(BranchCreateRequest.empty(), TREE, HEAD);

    assertThat(third.getName()).isEqualTo("Virtual branch 3");
  }

  @Test
  void createShouldUseConfiguredDefaultName() {
    properties.setDefaultBranchName("Lane");

    assertThat(service.create(BranchCreateRequest.empty(), TREE, HEAD).getName())
        .isEqualTo("Lane");
  }

  @Test
  void createShouldAppendByDefault() {
    create("a");
    create("b");

    assertThat(create("c").getOrder()).isEqualTo(2);
  }

  @Test
  void createAtOrderShouldShiftLaterBranches() {
    Branch a = create("a");
    Branch b = create("b");

    Branch inserted = service.create(new BranchCreateRequest("x", null, 1), TREE, HEAD);

    assertThat(inserted.getOrder()).isEqualTo(1);
    assertThat(service.get(a.getId()).getOrder()).isZero();
    assertThat(service.get(b.getId()).getOrder()).isEqualTo(2);
    assertThat(service.list()).extracting(Branch::getName).containsExactly("a", "x", "b");
  }

  @Test
  void createShouldRejectNegativeOrder() {
    assertThrows(IllegalArgumentException.class,
        () -> service.create(new BranchCreateRequest("x", null, -1), TREE, HEAD));
  }

  @Test
  void createShouldTakeClaimedHunksFromOtherBranches() {
    Branch first = service.create(
        new BranchCreateRequest("first", Ownership.parse("a.txt:1-10,20-30"), null), TREE, HEAD);

    service.create(new BranchCreateRequest("second", Ownership.parse("a.txt:5-6"), null),
        TREE, HEAD);

    assertThat(service.get(first.getId()).getOwnership())
        .isEqualTo(Ownership.parse("a.txt:20-30"));
  }

  @Test
  void claimShouldLeaveUnrelatedBranchesUntouched() {
    Branch unrelated = service.create(
        new BranchCreateRequest("unrelated", Ownership.parse("a.txt:50-60\nb.txt:1-2"), null),
        TREE, HEAD);
    clock.advance(1000);

    service.create(new BranchCreateRequest("claimer", Ownership.parse("a.txt:1-10"), null),
        TREE, HEAD);

    assertThat(service.get(unrelated.getId())).isEqualTo(unrelated);
  }

  @Test
  void updateShouldOnlyChangeGivenFields() {
    Branch branch = create("old");
    clock.advance(500);

    Branch updated = service.update(
        new BranchUpdateRequest(branch.getId(), "new", null, null, null, null));

    assertThat(updated.getName()).isEqualTo("new");
    assertThat(updated.getUpdatedTimestampMs()).isEqualTo(branch.getCreatedTimestampMs() + 500);
    assertThat(updated.getNotes()).isEqualTo(branch.getNotes());
    assertThat(updated.getOrder()).isEqualTo(branch.getOrder());
    assertThat(updated.getOwnership()).isEqualTo(branch.getOwnership());
    assertThat(updated.getCreatedTimestampMs()).isEqualTo(branch.getCreatedTimestampMs());
    assertThat(service.get(branch.getId())).isEqualTo(updated);
  }

  @Test
  void emptyUpdateShouldOnlyRefreshTimestamp() {
    Branch branch = create("same");
    clock.advance(10);

    Branch updated = service.update(patch(branch.getId()));

    branch.touch(branch.getCreatedTimestampMs() + 10);
    assertThat(updated).isEqualTo(branch);
  }

  @Test
  void updateShouldQualifyUpstreamWithDefaultRemote() {
    Branch branch = create("feature");

    Branch updated = service.update(
        new BranchUpdateRequest(branch.getId(), null, null, null, null, "feature/x"));

    assertThat(updated.getUpstream()).contains(RemoteRefname.of("origin", "feature/x"));
    assertThat(updated.getUpstream().orElseThrow().toString())
        .isEqualTo("refs/remotes/origin/feature/x");
  }

  @Test
  void updateShouldRejectInvalidUpstream() {
    Branch branch = create("feature");

    BranchLoadException e = assertThrows(BranchLoadException.class, () -> service.update(
        new BranchUpdateRequest(branch.getId(), "renamed", null, null, null, "bad..name")));

    assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID);
    assertThat(e.getField()).isEqualTo("meta/upstream");
    assertThat(service.get(branch.getId()).getName()).isEqualTo("feature");
  }

  @Test
  void updateOwnershipShouldReleaseFromOthers() {
    Branch first = service.create(
        new BranchCreateRequest("first", Ownership.parse("a.txt:1-10\nb.txt:1-2"), null),
        TREE, HEAD);
    Branch second = create("second");

    service.update(new BranchUpdateRequest(second.getId(), null, null,
        Ownership.parse("a.txt:3-4"), null, null));

    assertThat(service.get(first.getId()).getOwnership())
        .isEqualTo(Ownership.parse("b.txt:1-2"));
    assertThat(service.get(second.getId()).getOwnership())
        .isEqualTo(Ownership.parse("a.txt:3-4"));
  }

  @Test
  void updateUnknownBranchShouldFail() {
    BranchId id = BranchId.generate();

    VirtualBranchNotFoundException e = assertThrows(VirtualBranchNotFoundException.class,
        () -> service.update(patch(id)));

    assertThat(e.getKind()).isEqualTo(ErrorKind.BRANCH_NOT_FOUND);
  }

  @Test
  void setAppliedShouldPersist() {
    Branch branch = create("feature");

    service.setApplied(branch.getId(), true);

    assertThat(service.get(branch.getId()).isApplied()).isTrue();
  }

  @Test
  void moveOwnershipShouldTransferFile() {
    Branch source = service.create(
        new BranchCreateRequest("source", Ownership.parse("a.txt:1-2\nb.txt:5-9"), null),
        TREE, HEAD);
    Branch target = create("target");

    FileOwnership moved = service.moveOwnership(source.getId(), target.getId(), "b.txt");

    assertThat(moved).isEqualTo(FileOwnership.parse("b.txt:5-9"));
    assertThat(service.get(source.getId()).getOwnership())
        .isEqualTo(Ownership.parse("a.txt:1-2"));
    assertThat(service.get(target.getId()).getOwnership())
        .isEqualTo(Ownership.parse("b.txt:5-9"));
  }

  @Test
  void moveUnclaimedFileShouldChangeNothing() {
    Branch source = create("source");
    Branch target = create("target");

    FileOwnership moved = service.moveOwnership(source.getId(), target.getId(), "c.txt");

    assertThat(moved.isEmpty()).isTrue();
    assertThat(service.get(target.getId())).isEqualTo(target);
  }

  @Test
  void deleteShouldRemoveBranch() {
    Branch branch = create("gone");

    service.delete(branch.getId());

    assertThat(service.list()).isEmpty();
    assertThrows(VirtualBranchNotFoundException.class, () -> service.get(branch.getId()));
    assertThrows(VirtualBranchNotFoundException.class, () -> service.delete(branch.getId()));
  }

  /**
   * Clock whose time only moves when a test advances it.
   */
  private static final class TickingClock extends Clock {

    private long millis;

    TickingClock(long millis) {
      this.millis = millis;
    }

    void advance(long deltaMs) {
      millis += deltaMs;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis);
    }

    @Override
    public long millis() {
      return millis;
    }
  }
}
