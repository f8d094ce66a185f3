package org.chucc.vbranch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import org.chucc.vbranch.util.RefnameValidator;

/**
 * Value object for a remote-tracking reference name of the form
 * {@code refs/remotes/<remote>/<branch>}.
 * The branch part may itself contain "/" separated components.
 */
public record RemoteRefname(String remote, String branch) {

  public static final String PREFIX = "refs/remotes/";

  /**
   * Creates a new RemoteRefname with validation.
   *
   * @param remote the remote name (a single reference component)
   * @param branch the branch name on the remote
   * @throws IllegalArgumentException if either part is not a valid reference name
   */
  public RemoteRefname {
    RefnameValidator.validateComponent(remote, "Remote");
    RefnameValidator.validate(branch, "Branch");
  }

  /**
   * Parses a fully qualified remote reference name.
   *
   * @param refname the reference name, e.g. {@code refs/remotes/origin/feature/x}
   * @return the parsed RemoteRefname
   * @throws IllegalArgumentException if the text is not a remote reference name
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static RemoteRefname parse(String refname) {
    Objects.requireNonNull(refname, "Remote refname cannot be null");
    if (!refname.startsWith(PREFIX)) {
      throw new IllegalArgumentException(
          "Remote refname must start with '" + PREFIX + "': " + refname);
    }
    String rest = refname.substring(PREFIX.length());
    int slash = rest.indexOf('/');
    if (slash <= 0) {
      throw new IllegalArgumentException(
          "Remote refname must name a remote and a branch: " + refname);
    }
    return new RemoteRefname(rest.substring(0, slash), rest.substring(slash + 1));
  }

  /**
   * Qualifies a short branch name with a remote.
   *
   * @param remote the remote name
   * @param shortName the bare branch name, e.g. {@code feature/x}
   * @return the qualified RemoteRefname
   * @throws IllegalArgumentException if either name is invalid
   */
  public static RemoteRefname of(String remote, String shortName) {
    return new RemoteRefname(remote, shortName);
  }

  @JsonValue
  @Override
  public String toString() {
    return PREFIX + remote + "/" + branch;
  }
}
