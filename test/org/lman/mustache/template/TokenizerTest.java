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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.lman.mustache.template.Token.Kind;

public class TokenizerTest {

  private static List<Token> tokenize(String template) {
    List<Token> tokens = new ArrayList<Token>();
    Tokenizer tokenizer = new Tokenizer(template, Delimiters.DEFAULT);
    while (tokenizer.hasNext())
      tokens.add(tokenizer.next());
    return tokens;
  }

  private static void assertToken(Token token, Kind kind, String content) {
    assertEquals(token.toString(), kind, token.kind);
    assertEquals(token.toString(), content, token.content);
  }

  @Test
  public void textOnly() {
    List<Token> tokens = tokenize("no tags here\n");
    assertEquals(1, tokens.size());
    assertToken(tokens.get(0), Kind.TEXT, "no tags here\n");
  }

  @Test
  public void sigils() {
    List<Token> tokens = tokenize("{{a}}{{&b}}{{{c}}}{{#d}}{{^e}}{{/f}}{{>g}}{{!h}}");
    assertEquals(8, tokens.size());
    assertToken(tokens.get(0), Kind.VARIABLE, "a");
    assertToken(tokens.get(1), Kind.UNESCAPED_VARIABLE, "b");
    assertToken(tokens.get(2), Kind.UNESCAPED_VARIABLE, "c");
    assertToken(tokens.get(3), Kind.SECTION_OPEN, "d");
    assertToken(tokens.get(4), Kind.INVERTED_SECTION_OPEN, "e");
    assertToken(tokens.get(5), Kind.SECTION_CLOSE, "f");
    assertToken(tokens.get(6), Kind.PARTIAL, "g");
    assertToken(tokens.get(7), Kind.COMMENT, "h");
  }

  @Test
  public void namesAreTrimmedButCommentsAreNot() {
    List<Token> tokens = tokenize("{{  a.b  }}{{# c }}{{! d }}");
    assertToken(tokens.get(0), Kind.VARIABLE, "a.b");
    assertToken(tokens.get(1), Kind.SECTION_OPEN, "c");
    assertToken(tokens.get(2), Kind.COMMENT, " d ");
  }

  @Test
  public void positions() {
    List<Token> tokens = tokenize("ab\ncd {{x}}\n{{y}}");
    assertToken(tokens.get(0), Kind.TEXT, "ab\ncd ");
    assertEquals(1, tokens.get(0).line);
    assertEquals(1, tokens.get(0).column);

    Token x = tokens.get(1);
    assertEquals(2, x.line);
    assertEquals(4, x.column);
    assertEquals(6, x.start);
    assertEquals(11, x.end);

    Token y = tokens.get(3);
    assertEquals(3, y.line);
    assertEquals(1, y.column);
  }

  @Test
  public void delimiterChange() {
    Tokenizer tokenizer = new Tokenizer("{{=<% %>=}}<%x%>{{y}}", Delimiters.DEFAULT);
    assertToken(tokenizer.next(), Kind.DELIMITER_CHANGE, "<% %>");
    assertEquals(new Delimiters("<%", "%>"), tokenizer.delimiters());
    assertToken(tokenizer.next(), Kind.VARIABLE, "x");
    assertToken(tokenizer.next(), Kind.TEXT, "{{y}}");
    assertFalse(tokenizer.hasNext());
  }

  @Test
  public void tripleMustacheWithCustomDelimiters() {
    Tokenizer tokenizer = new Tokenizer("[{x}]", new Delimiters("[", "]"));
    assertToken(tokenizer.next(), Kind.UNESCAPED_VARIABLE, "x");
  }

  @Test
  public void standalone() {
    List<Token> tokens = tokenize("a\n  {{#x}}  \n{{/x}}\r\n{{y}}\n{{! c }} b\n\t{{>p}}");
    Token open = tokens.get(1);
    assertToken(open, Kind.SECTION_OPEN, "x");
    assertTrue(open.standalone);
    assertEquals("  ", open.indentation);

    Token close = tokens.get(3);
    assertToken(close, Kind.SECTION_CLOSE, "x");
    assertTrue(close.standalone);

    // Variables never stand alone.
    Token y = tokens.get(5);
    assertToken(y, Kind.VARIABLE, "y");
    assertFalse(y.standalone);

    // Something else on the line.
    Token comment = tokens.get(7);
    assertToken(comment, Kind.COMMENT, " c ");
    assertFalse(comment.standalone);

    Token partial = tokens.get(9);
    assertToken(partial, Kind.PARTIAL, "p");
    assertTrue(partial.standalone);
    assertEquals("\t", partial.indentation);
  }
}
