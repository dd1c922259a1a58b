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

/**
 * A mustache template, parsed once and rendered any number of times.
 *
 * Supports everything in the mustache manual:
 *   * {{foo}} and {{foo.bar}} interpolate (HTML escaped), {{{foo}}} and {{&foo}} don't escape.
 *   * {{#foo}}...{{/foo}} renders once per item of a list, once in the context of an object,
 *     once for any other truthy value, and hands its source to a {@link
 *     org.lman.mustache.data.Lambda}.
 *   * {{^foo}}...{{/foo}} renders if foo is falsy or missing.
 *   * {{>foo}} includes the partial foo from {@link RenderOptions#partialSource}.
 *   * {{! comments }} and {{=<% %>=}} delimiter changes.
 *   * {{.}} refers to the current item of a list while iterating.
 *
 * Data can be any Java object (maps, lists, arrays and public fields are all understood), a
 * {@link org.json.JSONObject} or a {@link org.lman.mustache.data.DataView}.
 */
public class Mustache {

  /** Source of the template. */
  public final String source;

  /** Top-level nodes. */
  private final List<Node> nodes;

  private Mustache(String source, List<Node> nodes) {
    this.source = source;
    this.nodes = nodes;
  }

  /**
   * Parses a template with the default {{ }} delimiters.
   */
  public static Mustache compile(String template) throws TemplateSyntaxException {
    return compile(template, Delimiters.DEFAULT);
  }

  public static Mustache compile(String template, Delimiters delimiters)
      throws TemplateSyntaxException {
    return new Mustache(template, Parser.parse(template, delimiters));
  }

  /**
   * Parses and renders a template in one go, with the delimiters from |options|.
   */
  public static String renderTemplate(String template, Object data, RenderOptions options) {
    return compile(template, options.delimiters).render(data, options);
  }

  public static String renderTemplate(String template, Object data) {
    return renderTemplate(template, data, RenderOptions.DEFAULTS);
  }

  public String render(Object data) {
    return render(data, RenderOptions.DEFAULTS);
  }

  public String render(Object data, RenderOptions options) {
    return execute(data, options).text;
  }

  /**
   * Renders the template, also returning the warnings raised under {@link MissingKeyPolicy#WARN}.
   */
  public RenderResult execute(Object data, RenderOptions options) {
    return Renderer.render(nodes, data, options);
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    for (Node node : nodes)
      buf.append(node);
    return buf.toString();
  }
}
