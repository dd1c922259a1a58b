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

import java.io.File;
import java.io.IOException;

import org.json.JSONException;
import org.junit.Test;
import org.lman.mustache.data.JSONObjectDataView;

/**
 * Runs all test cases found in the "data" directory. A test "foo" renders foo.template with
 * foo.json and compares against foo.expected; "foo_1" uses foo_1.json and foo_1.expected with the
 * same template. Partials are the other .template files in the directory.
 */
public class FixtureMustacheTest {

  private static final File DATA = new File("test/org/lman/mustache/template/data");
  private static final String TEMPLATE_EXT = ".template";
  private static final String JSON_EXT = ".json";
  private static final String EXPECTED_EXT = ".expected";

  static {
    if (!DATA.isDirectory()) {
      throw new AssertionError(DATA + " is not a directory");
    }
  }

  private static class TemplateTest {
    private final File templateFile;
    private final File jsonFile;
    private final String expected;

    TemplateTest(String name) throws IOException {
      String[] parts = name.split("_");
      String base = parts[0];
      String suffix = "";
      if (parts.length > 1)
        suffix = "_" + parts[1];

      this.templateFile = new File(DATA, base + TEMPLATE_EXT);
      this.jsonFile = new File(DATA, base + suffix + JSON_EXT);
      this.expected =
          ConformanceSuiteTest.getContents(new File(DATA, base + suffix + EXPECTED_EXT));
    }

    void run() throws IOException, JSONException {
      RenderOptions options = RenderOptions.builder()
          .withPartialSource(new DirectoryPartialSource(DATA, "template"))
          .build();
      String actual = Mustache.renderTemplate(
          ConformanceSuiteTest.getContents(templateFile),
          JSONObjectDataView.fromJson(ConformanceSuiteTest.getContents(jsonFile)),
          options);
      assertEquals(templateFile.getName(), expected, actual);
    }
  }

  private static void test(String testName) {
    try {
      new TemplateTest(testName).run();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  @Test
  public void flat() {
    test("flat");
  }

  @Test
  public void paths() {
    test("paths");
  }

  @Test
  public void objectSections() {
    test("objectSections");
  }

  @Test
  public void emptyLists() {
    test("emptyLists");
  }

  @Test
  public void invertedSections_0() {
    test("invertedSections_0");
  }

  @Test
  public void invertedSections_1() {
    test("invertedSections_1");
  }

  @Test
  public void invertedSections_2() {
    test("invertedSections_2");
  }

  @Test
  public void invertedSections_3() {
    test("invertedSections_3");
  }

  @Test
  public void escaping() {
    test("escaping");
  }

  @Test
  public void falsy() {
    test("falsy");
  }

  @Test
  public void nestedSameKey() {
    test("nestedSameKey");
  }

  @Test
  public void invertedCoercion() {
    test("invertedCoercion");
  }

  @Test
  public void indexLookup() {
    test("indexLookup");
  }

  @Test
  public void numericKeys() {
    test("numericKeys");
  }

  @Test
  public void delimiters() {
    test("delimiters");
  }

  @Test
  public void hasPartial() {
    test("hasPartial");
  }

  @Test
  public void iteratorPartial() {
    test("iteratorPartial");
  }

  @Test
  public void partialIndentation() {
    test("partialIndentation");
  }

  @Test
  public void nestedPartials() {
    test("nestedPartials");
  }
}
