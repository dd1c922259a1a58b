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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lman.mustache.data.DataView;
import org.lman.mustache.data.DataViews;
import org.lman.mustache.data.Lambda;

/**
 * The state of a render: the context stack, the text rendered so far and the warnings raised.
 *
 * Partials and lambdas render through a child renderer {@link #inSameContext in the same
 * context}, which shares the context stack and warnings but writes its own text, one level deeper.
 */
final class Renderer {

  private final RenderOptions options;
  private final Deque<DataView> contexts;
  private final List<String> warnings;
  // Partials parsed so far in this render, by name.
  private final Map<String, List<Node>> partials;

  private final StringBuilder text = new StringBuilder();
  // Written after every line break of template text, for indented partials.
  private final String padding;
  private int depth;

  private Renderer(RenderOptions options, Deque<DataView> contexts, List<String> warnings,
      Map<String, List<Node>> partials, String padding, int depth) {
    this.options = options;
    this.contexts = contexts;
    this.warnings = warnings;
    this.partials = partials;
    this.padding = padding;
    this.depth = depth;
  }

  /**
   * Renders |nodes| with |data| as the outermost context.
   */
  static RenderResult render(List<Node> nodes, Object data, RenderOptions options) {
    Deque<DataView> contexts = new ArrayDeque<DataView>();
    contexts.addFirst(DataViews.of(data));
    Renderer renderer = new Renderer(options, contexts, new ArrayList<String>(),
        new HashMap<String, List<Node>>(), "", 0);
    renderer.renderAll(nodes);
    return new RenderResult(renderer.text.toString(), renderer.warnings);
  }

  private Renderer inSameContext(String padding, String where) {
    if (depth + 1 > options.maxDepth)
      throw new RecursionLimitException(options.maxDepth, where);
    return new Renderer(options, contexts, warnings, partials, padding, depth + 1);
  }

  RenderOptions options() {
    return options;
  }

  void renderAll(List<Node> nodes) {
    for (Node node : nodes)
      node.render(this);
  }

  void append(String string) {
    text.append(string);
  }

  /**
   * Appends text that came from a template, as opposed to from data.
   */
  void appendText(String string) {
    if (padding.isEmpty()) {
      text.append(string);
      return;
    }
    for (int i = 0; i < string.length(); i++) {
      char c = string.charAt(i);
      text.append(c);
      if (c == '\n')
        text.append(padding);
    }
  }

  /**
   * Resolves a name in a variable, section or inverted section tag, applying the missing key
   * policy if it can't be.
   */
  DataView resolve(Identifier id, int line, int column) {
    DataView value = id.resolve(contexts);
    if (value == null) {
      switch (options.onMissingKey) {
        case IGNORE:
          break;
        case WARN:
          warn("Could not find key '" + id + "' (line " + line + ", column " + column + ")");
          break;
        case ERROR:
          throw new MissingKeyException(id.toString(), line, column);
      }
    }
    return value;
  }

  /**
   * Returns the text that a variable tag interpolates before escaping, or null if there's
   * nothing to escape.
   */
  String interpolate(Identifier id, int line, int column) {
    DataView value = resolve(id, line, column);
    if (value == null) {
      if (options.keepMissingTags)
        text.append(options.delimiters.open + " " + id + " " + options.delimiters.close);
      return null;
    }
    if (value.getType() == DataView.Type.LAMBDA) {
      String result = value.asLambda().apply("", lambdaRenderer(options.delimiters, id.toString()));
      return result == null ? "" : result;
    }
    return value.toText();
  }

  /**
   * Renders |nodes| with |context| as the innermost context, or in the current context if it's
   * null.
   */
  void renderInContext(DataView context, List<Node> nodes, String where) {
    if (++depth > options.maxDepth)
      throw new RecursionLimitException(options.maxDepth, where);
    if (context != null)
      contexts.addFirst(context);
    try {
      renderAll(nodes);
    } finally {
      if (context != null)
        contexts.removeFirst();
      depth--;
    }
  }

  void renderLambdaSection(Lambda lambda, String rawContent, Delimiters delimiters, String where) {
    String result = lambda.apply(rawContent, lambdaRenderer(delimiters, where));
    if (result == null || result.isEmpty())
      return;
    Renderer child = inSameContext(padding, where);
    child.renderAll(Parser.parse(result, delimiters));
    text.append(child.text);
  }

  private Lambda.Renderer lambdaRenderer(final Delimiters delimiters, final String where) {
    return new Lambda.Renderer() {
      @Override
      public String render(String template) {
        Renderer child = inSameContext("", where);
        child.renderAll(Parser.parse(template, delimiters));
        return child.text.toString();
      }

      @Override
      public String render(String template, Object data) {
        if (data == null)
          return render(template);
        contexts.addFirst(DataViews.of(data));
        try {
          return render(template);
        } finally {
          contexts.removeFirst();
        }
      }
    };
  }

  /**
   * Renders a partial in the current context. |indentation| is null unless the partial tag was
   * standalone, in which case every line of the partial's template is indented by it.
   */
  void renderPartial(String name, String indentation, int line, int column) {
    List<Node> nodes = partials.get(name);
    if (nodes == null) {
      String template = options.partialSource.get(name);
      if (template == null) {
        missingPartial(name, line, column);
        return;
      }
      nodes = Parser.parse(template, options.delimiters);
      partials.put(name, nodes);
    }

    String where = "partial " + name + " (line " + line + ", column " + column + ")";
    if (indentation == null || indentation.isEmpty()) {
      Renderer child = inSameContext(padding, where);
      child.renderAll(nodes);
      text.append(child.text);
      return;
    }

    String childPadding = padding + indentation;
    Renderer child = inSameContext(childPadding, where);
    child.renderAll(nodes);
    if (child.text.length() == 0)
      return;

    // The partial's own final line break ends the tag's line, so the next line only carries the
    // outer indentation.
    String trailing = "\n" + childPadding;
    if (child.text.length() >= trailing.length()
        && child.text.lastIndexOf(trailing) == child.text.length() - trailing.length()) {
      child.text.setLength(child.text.length() - indentation.length());
    }
    text.append(indentation).append(child.text);
  }

  private void missingPartial(String name, int line, int column) {
    switch (options.onMissingKey) {
      case IGNORE:
        break;
      case WARN:
        warn("Could not find partial '" + name + "' (line " + line + ", column " + column + ")");
        break;
      case ERROR:
        throw new MissingPartialException(name, line, column);
    }
  }

  private void warn(String message) {
    warnings.add(message);
    options.logger.warn(message);
  }
}
