// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.mustache.template;

/**
 * Where the text of {{>partial}} templates comes from.
 */
public interface PartialSource {

  /** Has no partials at all. */
  PartialSource NONE = new PartialSource() {
    @Override
    public String get(String name) {
      return null;
    }
  };

  /**
   * Returns the template text of the partial called |name|, or null if there isn't one.
   */
  String get(String name);
}
