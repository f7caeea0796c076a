// Copyright 2011 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.loginflow.authsource;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * An organization a user can log in to.
 */
@Immutable
public final class Organization {
  @Nonnull private final String id;
  @Nonnull private final String displayName;

  private Organization(String id, String displayName) {
    this.id = id;
    this.displayName = displayName;
  }

  @Nonnull
  public static Organization make(String id, String displayName) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(id));
    return new Organization(id, Strings.isNullOrEmpty(displayName) ? id : displayName);
  }

  @Nonnull
  public String getId() {
    return id;
  }

  @Nonnull
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof Organization)) { return false; }
    Organization other = (Organization) object;
    return id.equals(other.id) && displayName.equals(other.displayName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, displayName);
  }

  @Override
  public String toString() {
    return id + "=" + displayName;
  }
}
