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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits a template into text and tags, one {@link Token} at a time.
 *
 * The tokens cover the whole template: every character is either in a text token or inside the
 * span of a tag. A {{=open close=}} tag changes the delimiters for the rest of this tokenizer's
 * template; {@link #delimiters()} always returns the pair currently in effect.
 */
final class Tokenizer implements Iterator<Token> {

  private final String source;
  private Delimiters delimiters;

  private int pos = 0;
  private int line = 1;
  private int lineStart = 0;

  Tokenizer(String source, Delimiters delimiters) {
    this.source = source;
    this.delimiters = delimiters;
  }

  Delimiters delimiters() {
    return delimiters;
  }

  String source() {
    return source;
  }

  @Override
  public boolean hasNext() {
    return pos < source.length();
  }

  @Override
  public Token next() {
    if (!hasNext())
      throw new NoSuchElementException();

    int tagStart = source.indexOf(delimiters.open, pos);
    if (tagStart == pos)
      return nextTag();

    int textEnd = (tagStart < 0) ? source.length() : tagStart;
    Token text = Token.text(source.substring(pos, textEnd), pos, line, column(pos));
    advanceTo(textEnd);
    return text;
  }

  private Token nextTag() {
    int start = pos;
    int tagLine = line;
    int tagColumn = column(start);

    int bodyStart = start + delimiters.open.length();
    Token.Kind kind = Token.Kind.VARIABLE;
    String close = delimiters.close;
    if (bodyStart < source.length()) {
      switch (source.charAt(bodyStart)) {
        case '#': kind = Token.Kind.SECTION_OPEN; break;
        case '^': kind = Token.Kind.INVERTED_SECTION_OPEN; break;
        case '/': kind = Token.Kind.SECTION_CLOSE; break;
        case '>': kind = Token.Kind.PARTIAL; break;
        case '!': kind = Token.Kind.COMMENT; break;
        case '&': kind = Token.Kind.UNESCAPED_VARIABLE; break;
        case '{':
          kind = Token.Kind.UNESCAPED_VARIABLE;
          close = "}" + delimiters.close;
          break;
        case '=':
          kind = Token.Kind.DELIMITER_CHANGE;
          close = "=" + delimiters.close;
          break;
        default:
          break;
      }
      if (kind != Token.Kind.VARIABLE)
        bodyStart++;
    }

    int bodyEnd = source.indexOf(close, bodyStart);
    if (bodyEnd < 0)
      throw new TemplateSyntaxException("Unclosed tag", tagLine, tagColumn);
    int end = bodyEnd + close.length();

    String body = source.substring(bodyStart, bodyEnd);
    // An empty name is allowed; it just never resolves.
    String name = (kind == Token.Kind.COMMENT) ? body : body.trim();

    Delimiters newDelimiters = null;
    if (kind == Token.Kind.DELIMITER_CHANGE)
      newDelimiters = parseDelimiters(name, tagLine, tagColumn);

    boolean standalone = false;
    String indentation = "";
    if (kind.canStandAlone) {
      int lineBegin = start;
      while (lineBegin > 0 && isBlank(source.charAt(lineBegin - 1)))
        lineBegin--;
      if (lineBegin == 0 || source.charAt(lineBegin - 1) == '\n') {
        int after = end;
        while (after < source.length() && isBlank(source.charAt(after)))
          after++;
        if (after == source.length() || startsWithNewLine(after)) {
          standalone = true;
          indentation = source.substring(lineBegin, start);
        }
      }
    }

    Token tag = Token.tag(kind, name, start, end, tagLine, tagColumn, standalone, indentation);
    advanceTo(end);
    if (newDelimiters != null)
      delimiters = newDelimiters;
    return tag;
  }

  private static Delimiters parseDelimiters(String body, int line, int column) {
    String[] parts = body.split("\\s+");
    if (parts.length != 2 || parts[0].contains("=") || parts[1].contains("="))
      throw new TemplateSyntaxException("Bad set delimiter tag '" + body + "'", line, column);
    return new Delimiters(parts[0], parts[1]);
  }

  private boolean startsWithNewLine(int index) {
    return source.startsWith("\n", index) || source.startsWith("\r\n", index);
  }

  private static boolean isBlank(char c) {
    return c == ' ' || c == '\t';
  }

  private int column(int offset) {
    return offset - lineStart + 1;
  }

  private void advanceTo(int newPos) {
    for (int i = pos; i < newPos; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    pos = newPos;
  }
}
