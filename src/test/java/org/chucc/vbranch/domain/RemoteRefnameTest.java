package org.chucc.vbranch.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RemoteRefnameTest {

  @Test
  void shouldParseRemoteAndBranch() {
    RemoteRefname ref = RemoteRefname.parse("refs/remotes/origin/main");

    assertThat(ref.remote()).isEqualTo("origin");
    assertThat(ref.branch()).isEqualTo("main");
    assertThat(ref.toString()).isEqualTo("refs/remotes/origin/main");
  }

  @Test
  void shouldKeepSlashesInBranchPart() {
    RemoteRefname ref = RemoteRefname.parse("refs/remotes/upstream/feature/login-form");

    assertThat(ref.remote()).isEqualTo("upstream");
    assertThat(ref.branch()).isEqualTo("feature/login-form");
  }

  @Test
  void shouldQualifyShortName() {
    assertThat(RemoteRefname.of("origin", "fix/typo").toString())
        .isEqualTo("refs/remotes/origin/fix/typo");
  }

  @Test
  void shouldRejectOtherNamespaces() {
    assertThatThrownBy(() -> RemoteRefname.parse("refs/heads/main"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("refs/remotes/");
  }

  @Test
  void shouldRejectMissingBranch() {
    assertThatThrownBy(() -> RemoteRefname.parse("refs/remotes/origin"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RemoteRefname.parse("refs/remotes/origin/"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RemoteRefname.parse("refs/remotes//main"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRejectInvalidBranchNames() {
    assertThatThrownBy(() -> RemoteRefname.of("origin", "has space"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RemoteRefname.of("origin", "a..b"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RemoteRefname.of("origin", "topic.lock"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
