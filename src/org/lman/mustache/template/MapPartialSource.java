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

import java.util.HashMap;
import java.util.Map;

/**
 * Partials held in memory, by name.
 */
public class MapPartialSource implements PartialSource {

  private final Map<String, String> partials;

  public MapPartialSource(Map<String, String> partials) {
    this.partials = new HashMap<String, String>(partials);
  }

  public MapPartialSource() {
    this(new HashMap<String, String>());
  }

  /**
   * Adds (or replaces) a partial, returning this for chaining.
   */
  public MapPartialSource put(String name, String template) {
    partials.put(name, template);
    return this;
  }

  @Override
  public String get(String name) {
    return partials.get(name);
  }
}
