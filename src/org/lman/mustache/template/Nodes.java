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

import java.util.List;

import org.lman.mustache.data.DataView;
import org.lman.mustache.data.DataView.ArrayVisitor;

/**
 * The {@link Node}s a {@link Parser} builds.
 */
final class Nodes {

  private Nodes() {}

  /**
   * Generic implementation of a node for a tag, which knows where in the template it came from.
   */
  private static abstract class TagNode implements Node {
    protected final Identifier id;
    protected final int line;
    protected final int column;

    protected TagNode(Identifier id, int line, int column) {
      this.id = id;
      this.line = line;
      this.column = column;
    }

    protected String where() {
      return id + " (line " + line + ", column " + column + ")";
    }
  }

  /**
   * Generic implementation of a tag that owns a body.
   */
  private static abstract class BlockNode extends TagNode {
    protected final List<Node> content;

    protected BlockNode(Identifier id, List<Node> content, int line, int column) {
      super(id, line, column);
      this.content = content;
    }

    protected static String toString(List<Node> nodes) {
      StringBuilder buf = new StringBuilder();
      for (Node node : nodes)
        buf.append(node);
      return buf.toString();
    }
  }

  /**
   * A node containing a string (may have \n etc). The basic building block of the templates.
   * Standalone tags trim the whitespace around them out of their neighbouring strings while the
   * template is being parsed.
   */
  static class StringNode implements Node {
    private String string;

    StringNode(String string) {
      this.string = string;
    }

    @Override
    public void render(Renderer renderer) {
      renderer.appendText(string);
    }

    boolean isEmpty() {
      return string.isEmpty();
    }

    /**
     * Removes leading spaces and tabs up to and including the first line break, if the string
     * starts with a (possibly blank) line.
     */
    void trimStartingNewLine() {
      int index = 0;
      while (index < string.length() && isBlank(string.charAt(index)))
        index++;
      if (string.startsWith("\r\n", index))
        string = string.substring(index + 2);
      else if (string.startsWith("\n", index))
        string = string.substring(index + 1);
      else if (index == string.length())
        string = "";
    }

    /**
     * Removes up to |count| trailing spaces and tabs.
     */
    void trimEndingSpaces(int count) {
      int index = string.length();
      while (index > 0 && count > 0 && isBlank(string.charAt(index - 1))) {
        index--;
        count--;
      }
      string = string.substring(0, index);
    }

    private static boolean isBlank(char c) {
      return c == ' ' || c == '\t';
    }

    @Override
    public String toString() {
      return "STRING(" + string + ")";
    }
  }

  /**
   * {{foo}}
   */
  static class EscapedVariableNode extends TagNode {
    EscapedVariableNode(Identifier id, int line, int column) {
      super(id, line, column);
    }

    @Override
    public void render(Renderer renderer) {
      String text = renderer.interpolate(id, line, column);
      if (text == null)
        return;
      if (renderer.options().escapeHtml)
        renderer.append(escapeHtml(text));
      else
        renderer.append(text);
    }

    static String escapeHtml(String unescaped) {
      StringBuilder escaped = new StringBuilder(unescaped.length());
      for (int i = 0; i < unescaped.length(); i++) {
        char c = unescaped.charAt(i);
        switch (c) {
          case '&': escaped.append("&amp;"); break;
          case '<': escaped.append("&lt;"); break;
          case '>': escaped.append("&gt;"); break;
          case '"': escaped.append("&quot;"); break;
          case '\'': escaped.append("&#39;"); break;
          default: escaped.append(c);
        }
      }
      return escaped.toString();
    }

    @Override
    public String toString() {
      return "{{" + id + "}}";
    }
  }

  /**
   * {{{foo}}} and {{&foo}}
   */
  static class UnescapedVariableNode extends TagNode {
    UnescapedVariableNode(Identifier id, int line, int column) {
      super(id, line, column);
    }

    @Override
    public void render(Renderer renderer) {
      String text = renderer.interpolate(id, line, column);
      if (text != null)
        renderer.append(text);
    }

    @Override
    public String toString() {
      return "{{{" + id + "}}}";
    }
  }

  /**
   * {{#foo}} {{/foo}}
   */
  static class SectionNode extends BlockNode {
    private final String rawContent;
    private final Delimiters delimiters;

    SectionNode(Identifier id, List<Node> content, String rawContent, Delimiters delimiters,
        int line, int column) {
      super(id, content, line, column);
      this.rawContent = rawContent;
      this.delimiters = delimiters;
    }

    @Override
    public void render(final Renderer renderer) {
      DataView value = renderer.resolve(id, line, column);
      if (value == null || !value.isTruthy())
        return;

      switch (value.getType()) {
        case ARRAY:
          value.asArrayForeach(new ArrayVisitor() {
            @Override
            public void visit(DataView item, int index) {
              renderer.renderInContext(item, content, where());
            }
          });
          break;

        case OBJECT:
          renderer.renderInContext(value, content, where());
          break;

        case LAMBDA:
          renderer.renderLambdaSection(value.asLambda(), rawContent, delimiters, where());
          break;

        default:
          renderer.renderInContext(null, content, where());
          break;
      }
    }

    @Override
    public String toString() {
      return "{{#" + id + "}}" + toString(content) + "{{/" + id + "}}";
    }
  }

  /**
   * {{^foo}} {{/foo}}
   */
  static class InvertedSectionNode extends BlockNode {
    InvertedSectionNode(Identifier id, List<Node> content, int line, int column) {
      super(id, content, line, column);
    }

    @Override
    public void render(Renderer renderer) {
      DataView value = renderer.resolve(id, line, column);
      if (value == null || !value.isTruthy())
        renderer.renderAll(content);
    }

    @Override
    public String toString() {
      return "{{^" + id + "}}" + toString(content) + "{{/" + id + "}}";
    }
  }

  /**
   * {{>foo}}
   */
  static class PartialNode implements Node {
    private final String name;
    private final String indentation;
    private final int line;
    private final int column;

    /**
     * |indentation| is what preceded a standalone partial on its line, or null if the partial
     * wasn't standalone.
     */
    PartialNode(String name, String indentation, int line, int column) {
      this.name = name;
      this.indentation = indentation;
      this.line = line;
      this.column = column;
    }

    @Override
    public void render(Renderer renderer) {
      renderer.renderPartial(name, indentation, line, column);
    }

    @Override
    public String toString() {
      return "{{>" + name + "}}";
    }
  }
}
