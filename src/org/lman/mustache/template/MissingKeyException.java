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
 * Thrown when a name can't be resolved in any context and missing keys are errors.
 *
 * @see MissingKeyPolicy#ERROR
 */
public class MissingKeyException extends MustacheException {
  private static final long serialVersionUID = 1L;

  private final String key;
  private final int line;
  private final int column;

  public MissingKeyException(String key, int line, int column) {
    super("Could not find key '" + key + "' (line " + line + ", column " + column + ")");
    this.key = key;
    this.line = line;
    this.column = column;
  }

  public String getKey() {
    return key;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
