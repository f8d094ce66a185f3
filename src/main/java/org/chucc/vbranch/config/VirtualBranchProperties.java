package org.chucc.vbranch.config;

import org.chucc.vbranch.util.RefnameValidator;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for virtual branch records.
 */
@Component
@ConfigurationProperties(prefix = "vbranch")
public class VirtualBranchProperties {

  /**
   * Name given to a branch created without one.
   * Generated names are made unique by appending " 2", " 3", and so on.
   */
  private String defaultBranchName = "Virtual branch";

  /**
   * Remote used to qualify the short upstream names of update requests.
   */
  private String defaultRemote = "origin";

  /**
   * Key root below which branch records are stored.
   */
  private String storeRoot = "branches";

  /**
   * Gets the name given to a branch created without one.
   *
   * @return the default branch name
   */
  public String getDefaultBranchName() {
    return defaultBranchName;
  }

  /**
   * Sets the name given to a branch created without one.
   *
   * @param defaultBranchName the default branch name (must be non-blank)
   * @throws IllegalArgumentException if the name is blank
   */
  public void setDefaultBranchName(String defaultBranchName) {
    if (defaultBranchName == null || defaultBranchName.isBlank()) {
      throw new IllegalArgumentException("Default branch name cannot be blank");
    }
    this.defaultBranchName = defaultBranchName;
  }

  /**
   * Gets the remote used to qualify upstream names.
   *
   * @return the remote name
   */
  public String getDefaultRemote() {
    return defaultRemote;
  }

  /**
   * Sets the remote used to qualify upstream names.
   *
   * @param defaultRemote the remote name (must be a single valid reference component)
   * @throws IllegalArgumentException if the name is not a valid remote name
   */
  public void setDefaultRemote(String defaultRemote) {
    RefnameValidator.validateComponent(defaultRemote, "Remote");
    this.defaultRemote = defaultRemote;
  }

  /**
   * Gets the key root of branch records.
   *
   * @return the store root
   */
  public String getStoreRoot() {
    return storeRoot;
  }

  /**
   * Sets the key root of branch records.
   *
   * @param storeRoot the store root (must be non-blank, without leading or trailing "/")
   * @throws IllegalArgumentException if the root is blank or has a leading or trailing "/"
   */
  public void setStoreRoot(String storeRoot) {
    if (storeRoot == null || storeRoot.isBlank()) {
      throw new IllegalArgumentException("Store root cannot be blank");
    }
    if (storeRoot.startsWith("/") || storeRoot.endsWith("/")) {
      throw new IllegalArgumentException("Store root cannot start or end with '/': " + storeRoot);
    }
    this.storeRoot = storeRoot;
  }
}
