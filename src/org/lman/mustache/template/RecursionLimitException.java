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
 * Thrown when sections, partials and lambdas nest deeper than {@link RenderOptions#maxDepth},
 * typically because a partial includes itself.
 */
public class RecursionLimitException extends MustacheException {
  private static final long serialVersionUID = 1L;

  private final int limit;

  public RecursionLimitException(int limit, String where) {
    super("Exceeded the maximum render depth of " + limit + " at " + where);
    this.limit = limit;
  }

  public int getLimit() {
    return limit;
  }
}
