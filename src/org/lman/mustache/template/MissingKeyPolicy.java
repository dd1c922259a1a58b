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
 * What to do when a name resolves to nothing in any context, or a partial can't be found.
 */
public enum MissingKeyPolicy {
  /** Render nothing. */
  IGNORE,
  /** Render nothing, but log a warning and add it to {@link RenderResult#warnings}. */
  WARN,
  /** Fail the render with {@link MissingKeyException} or {@link MissingPartialException}. */
  ERROR
}
