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

package com.google.enterprise.loginflow.ulf;

import com.google.enterprise.loginflow.authncontroller.LoginPage;

/**
 * Turns a login page's view model into markup.
 */
public interface LoginFormRenderer {

  /**
   * Renders a login form.
   *
   * @param page The page's view model.
   * @param actionUrl The URL the form posts to.
   * @return The page's HTML.
   */
  String generateForm(LoginPage page, String actionUrl);
}
