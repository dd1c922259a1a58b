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
 * Thrown when the {@link PartialSource} has no template for a partial and missing keys are
 * errors.
 *
 * @see MissingKeyPolicy#ERROR
 */
public class MissingPartialException extends MustacheException {
  private static final long serialVersionUID = 1L;

  private final String partialName;
  private final int line;
  private final int column;

  public MissingPartialException(String partialName, int line, int column) {
    super("Could not find partial '" + partialName + "' (line " + line + ", column " + column
        + ")");
    this.partialName = partialName;
    this.line = line;
    this.column = column;
  }

  public String getPartialName() {
    return partialName;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
