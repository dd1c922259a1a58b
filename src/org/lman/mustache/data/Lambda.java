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

package org.lman.mustache.data;

/**
 * A callable value in the data context.
 *
 * As a variable, {{foo}}, it's called with empty text and whatever it returns is interpolated
 * as-is (escaped like any other value, never parsed).
 *
 * As a section, {{#foo}}...{{/foo}}, it's called once with the unparsed source of the section
 * body, and whatever it returns is rendered as a template in the section's context.
 */
public interface Lambda {

  /**
   * Renders template text in the context the lambda was called from.
   */
  interface Renderer {
    String render(String template);

    /**
     * Like {@link #render(String)} with |data| as the innermost context.
     */
    String render(String template, Object data);
  }

  String apply(String text, Renderer renderer);
}
