/*
 * Copyright 2026 The Cerberus Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cerberus.authserver;

/** Wire version of the check API a call arrived on. */
public enum CheckRequestVersion {
  V2("v2"),
  V3("v3");

  private final String label;

  CheckRequestVersion(String label) {
    this.label = label;
  }

  /** Returns the value recorded in the version metric label. */
  public String label() {
    return label;
  }
}
