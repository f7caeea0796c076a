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

package com.google.enterprise.loginflow.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A link to an alternate login page, shown below the login form.
 */
@Immutable
public final class LoginLink {

  private String href;
  private String text;

  // For Gson.
  private LoginLink() {
  }

  private LoginLink(String href, String text) {
    this.href = href;
    this.text = text;
  }

  @Nonnull
  public static LoginLink make(String href, String text) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(href));
    return new LoginLink(href, Strings.nullToEmpty(text));
  }

  public String getHref() {
    return href;
  }

  public String getText() {
    return Strings.nullToEmpty(text);
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof LoginLink)) { return false; }
    LoginLink other = (LoginLink) object;
    return Objects.equals(href, other.href) && Objects.equals(getText(), other.getText());
  }

  @Override
  public int hashCode() {
    return Objects.hash(href, getText());
  }

  @Override
  public String toString() {
    return "<" + href + "> " + getText();
  }
}
