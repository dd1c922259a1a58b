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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TemplateSyntaxExceptionTest {

  @Test
  public void unclosedTag() {
    expectSyntaxError("hello {{ foo } bar", 1, 7);
    expectSyntaxError("hello {{{foo}} bar", 1, 7);
    expectSyntaxError("{{=<% %>}}", 1, 1);
  }

  @Test
  public void emptyCommentIsFine() {
    assertEquals("hello ", Mustache.renderTemplate("hello {{!}}", null));
  }

  @Test
  public void badSetDelimiter() {
    expectSyntaxError("{{= a b c =}}", 1, 1);
    expectSyntaxError("{{=<%=}}", 1, 1);
    expectSyntaxError("{{=a= b=}}", 1, 1);
  }

  @Test
  public void preterminatedSection() {
    expectSyntaxError("hello {{/flats1}}", 1, 7);
  }

  @Test
  public void unterminatedSection() {
    expectSyntaxError("hello {{#flats1}}blah", 1, 7);
    expectSyntaxError("line one\n  {{^flats1}}\nblah\n", 2, 3);
  }

  @Test
  public void unmatchedSection() {
    TemplateSyntaxException e = expectSyntaxError("hello {{#flats1}}blah{{/flats2}}", 1, 22);
    assertTrue(e.getMessage(), e.getMessage().contains("flats1"));
    assertTrue(e.getMessage(), e.getMessage().contains("flats2"));
  }

  @Test
  public void lineAndColumnInMessage() {
    TemplateSyntaxException e = expectSyntaxError("a\nb\n\tc {{/d}}", 3, 4);
    assertTrue(e.getMessage(), e.getMessage().endsWith("(line 3, column 4)"));
  }

  @Test
  public void errorsInPartialsSurfaceOnRender() {
    RenderOptions options = RenderOptions.builder()
        .withPartialSource(new MapPartialSource().put("broken", "{{#oops}}"))
        .build();
    Mustache template = Mustache.compile("before {{>broken}} after");
    try {
      template.render(null, options);
      fail();
    } catch (TemplateSyntaxException expected) {
      assertEquals(1, expected.getLine());
    }
  }

  private static TemplateSyntaxException expectSyntaxError(String template, int line, int column) {
    try {
      Mustache.compile(template);
    } catch (TemplateSyntaxException expected) {
      assertEquals(expected.getMessage(), line, expected.getLine());
      assertEquals(expected.getMessage(), column, expected.getColumn());
      return expected;
    }
    fail("Expected a syntax error from " + template);
    return null;
  }
}
