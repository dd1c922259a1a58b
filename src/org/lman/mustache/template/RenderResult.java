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

import java.util.Collections;
import java.util.List;

/**
 * Return value from {@link Mustache#execute}.
 */
public class RenderResult {
  public final String text;
  public final List<String> warnings;

  public RenderResult(String text, List<String> warnings) {
    this.text = text;
    this.warnings = Collections.unmodifiableList(warnings);
  }

  @Override
  public String toString() {
    return "RenderResult{ text: " + text + ", warnings: " + warnings + " }";
  }
}
