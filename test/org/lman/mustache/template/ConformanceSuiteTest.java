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

import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

/**
 * Runs the Mustache conformance suites in the "suites" directory. Each suite is a JSON object
 * with a list of tests, each having a name, data, a template, optional partials and the
 * expected output.
 */
public class ConformanceSuiteTest {

  private static final File SUITES = new File("test/org/lman/mustache/template/suites");

  static {
    if (!SUITES.isDirectory()) {
      throw new AssertionError(SUITES + " is not a directory");
    }
  }

  static String getContents(File file) throws IOException {
    StringBuilder contents = new StringBuilder();
    Reader in = new InputStreamReader(new FileInputStream(file), "UTF-8");
    try {
      char[] buf = new char[4096];
      int read;
      while ((read = in.read(buf)) != -1)
        contents.append(buf, 0, read);
    } finally {
      in.close();
    }
    return contents.toString();
  }

  private static void runSuite(String suite) throws IOException {
    JSONObject json = new JSONObject(getContents(new File(SUITES, suite + ".json")));
    JSONArray tests = json.getJSONArray("tests");
    List<String> failures = new ArrayList<String>();

    for (int i = 0; i < tests.length(); i++) {
      JSONObject test = tests.getJSONObject(i);
      String name = test.getString("name");

      MapPartialSource partials = new MapPartialSource();
      JSONObject partialsJson = test.optJSONObject("partials");
      if (partialsJson != null) {
        Iterator<String> keys = partialsJson.keys();
        while (keys.hasNext()) {
          String key = keys.next();
          partials.put(key, partialsJson.getString(key));
        }
      }

      RenderOptions options = RenderOptions.builder().withPartialSource(partials).build();
      String expected = test.getString("expected");
      String actual;
      try {
        actual = Mustache.renderTemplate(test.getString("template"), test.get("data"), options);
      } catch (MustacheException e) {
        failures.add(suite + " / " + name + ": threw " + e);
        continue;
      }
      if (!expected.equals(actual)) {
        failures.add(suite + " / " + name + ": expected "
            + JSONObject.quote(expected) + " but was " + JSONObject.quote(actual));
      }
    }

    assertTrue(failures.toString(), failures.isEmpty());
  }

  @Test
  public void interpolation() throws IOException {
    runSuite("interpolation");
  }

  @Test
  public void sections() throws IOException {
    runSuite("sections");
  }

  @Test
  public void inverted() throws IOException {
    runSuite("inverted");
  }

  @Test
  public void comments() throws IOException {
    runSuite("comments");
  }

  @Test
  public void delimiters() throws IOException {
    runSuite("delimiters");
  }

  @Test
  public void partials() throws IOException {
    runSuite("partials");
  }
}
