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
 * A run of text or a single tag, as produced by the {@link Tokenizer}.
 */
final class Token {

  enum Kind {
    TEXT                 (false),
    VARIABLE             (false),
    UNESCAPED_VARIABLE   (false),
    SECTION_OPEN         (true),
    INVERTED_SECTION_OPEN(true),
    SECTION_CLOSE        (true),
    PARTIAL              (true),
    COMMENT              (true),
    DELIMITER_CHANGE     (true);

    /** Whether a tag of this kind on a line of its own takes the line with it. */
    final boolean canStandAlone;

    Kind(boolean canStandAlone) {
      this.canStandAlone = canStandAlone;
    }
  }

  final Kind kind;
  /** The text for TEXT, otherwise the trimmed tag name (or comment body). */
  final String content;
  /** Offset of the first character, inclusive. */
  final int start;
  /** Offset after the last character. */
  final int end;
  final int line;
  final int column;
  final boolean standalone;
  /** The spaces and tabs before a standalone tag on its line. */
  final String indentation;

  private Token(Kind kind, String content, int start, int end, int line, int column,
      boolean standalone, String indentation) {
    this.kind = kind;
    this.content = content;
    this.start = start;
    this.end = end;
    this.line = line;
    this.column = column;
    this.standalone = standalone;
    this.indentation = indentation;
  }

  static Token text(String text, int start, int line, int column) {
    return new Token(Kind.TEXT, text, start, start + text.length(), line, column, false, "");
  }

  static Token tag(Kind kind, String name, int start, int end, int line, int column,
      boolean standalone, String indentation) {
    return new Token(kind, name, start, end, line, column, standalone, indentation);
  }

  boolean isTag() {
    return kind != Kind.TEXT;
  }

  @Override
  public String toString() {
    return kind + "(" + content + ")@" + line + ":" + column + (standalone ? " standalone" : "");
  }
}
