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
 * Thrown if a template is malformed: an unclosed tag, a bad delimiter change, or sections that
 * don't pair up.
 */
public class TemplateSyntaxException extends MustacheException {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final int column;

  public TemplateSyntaxException(String error, int line, int column) {
    super(error + " (line " + line + ", column " + column + ")");
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
