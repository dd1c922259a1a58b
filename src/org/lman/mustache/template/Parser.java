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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.lman.mustache.template.Nodes.EscapedVariableNode;
import org.lman.mustache.template.Nodes.InvertedSectionNode;
import org.lman.mustache.template.Nodes.PartialNode;
import org.lman.mustache.template.Nodes.SectionNode;
import org.lman.mustache.template.Nodes.StringNode;
import org.lman.mustache.template.Nodes.UnescapedVariableNode;

/**
 * Builds the tree of {@link Node}s for a template from its {@link Token}s.
 *
 * Sections are matched up with an explicit stack. Standalone tags are trimmed out of the text
 * around them as the tree is built, so a tag on a line of its own leaves no blank line behind.
 * Comments and delimiter changes leave no node at all.
 */
final class Parser {

  /**
   * A section whose close tag hasn't been seen yet.
   */
  private static class OpenSection {
    final Token token;
    // The delimiters in effect inside the section, for lambdas to re-parse its body with.
    final Delimiters delimiters;
    final List<Node> content = new ArrayList<Node>();

    OpenSection(Token token, Delimiters delimiters) {
      this.token = token;
      this.delimiters = delimiters;
    }
  }

  private final Tokenizer tokens;
  private final List<Node> root = new ArrayList<Node>();
  private final Deque<OpenSection> sections = new ArrayDeque<OpenSection>();

  // The text node immediately before the current token, if there was one.
  private StringNode previousString = null;
  private boolean trimNextNewLine = false;

  private Parser(String template, Delimiters delimiters) {
    this.tokens = new Tokenizer(template, delimiters);
  }

  /**
   * Parses |template|, starting out with |delimiters|.
   *
   * @throws TemplateSyntaxException if the template is malformed
   */
  static List<Node> parse(String template, Delimiters delimiters) {
    return new Parser(template, delimiters).parse();
  }

  private List<Node> parse() {
    while (tokens.hasNext()) {
      Token token = tokens.next();
      if (token.isTag())
        addTag(token);
      else
        addString(token);
    }

    if (!sections.isEmpty()) {
      Token open = sections.peek().token;
      throw new TemplateSyntaxException(
          "Unclosed section '" + open.content + "'", open.line, open.column);
    }
    return root;
  }

  private List<Node> currentNodes() {
    return sections.isEmpty() ? root : sections.peek().content;
  }

  private void addString(Token token) {
    StringNode string = new StringNode(token.content);
    if (trimNextNewLine)
      string.trimStartingNewLine();
    trimNextNewLine = false;

    if (string.isEmpty()) {
      previousString = null;
    } else {
      currentNodes().add(string);
      previousString = string;
    }
  }

  private void addTag(Token token) {
    if (token.standalone) {
      if (previousString != null) {
        previousString.trimEndingSpaces(token.indentation.length());
        if (previousString.isEmpty()) {
          List<Node> nodes = currentNodes();
          nodes.remove(nodes.size() - 1);
        }
      }
      trimNextNewLine = true;
    } else {
      trimNextNewLine = false;
    }
    previousString = null;

    Identifier id;
    switch (token.kind) {
      case VARIABLE:
        id = new Identifier(token.content);
        currentNodes().add(new EscapedVariableNode(id, token.line, token.column));
        break;

      case UNESCAPED_VARIABLE:
        id = new Identifier(token.content);
        currentNodes().add(new UnescapedVariableNode(id, token.line, token.column));
        break;

      case PARTIAL:
        currentNodes().add(new PartialNode(
            token.content,
            token.standalone ? token.indentation : null,
            token.line,
            token.column));
        break;

      case SECTION_OPEN:
      case INVERTED_SECTION_OPEN:
        sections.push(new OpenSection(token, tokens.delimiters()));
        break;

      case SECTION_CLOSE:
        closeSection(token);
        break;

      case COMMENT:
      case DELIMITER_CHANGE:
        // Only there for the whitespace; the tokenizer has already switched delimiters.
        break;

      case TEXT:
        throw new AssertionError(token);
    }
  }

  private void closeSection(Token close) {
    if (sections.isEmpty()) {
      throw new TemplateSyntaxException(
          "Trying to close section '" + close.content + "' which was never opened",
          close.line,
          close.column);
    }

    OpenSection open = sections.pop();
    if (!open.token.content.equals(close.content)) {
      throw new TemplateSyntaxException(
          "Start section '" + open.token.content + "' doesn't match end section '"
              + close.content + "'",
          close.line,
          close.column);
    }

    Identifier id = new Identifier(open.token.content);
    Node section;
    if (open.token.kind == Token.Kind.SECTION_OPEN) {
      String rawContent = tokens.source().substring(open.token.end, close.start);
      section = new SectionNode(
          id, open.content, rawContent, open.delimiters, open.token.line, open.token.column);
    } else {
      section = new InvertedSectionNode(id, open.content, open.token.line, open.token.column);
    }
    currentNodes().add(section);
  }
}
