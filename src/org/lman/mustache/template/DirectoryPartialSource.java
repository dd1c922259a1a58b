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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partials read from files named |name|.|extension| in a directory. Files that are absent or
 * can't be read count as missing partials.
 */
public class DirectoryPartialSource implements PartialSource {

  public static final String DEFAULT_EXTENSION = "mustache";

  private static final Logger LOG = LoggerFactory.getLogger(DirectoryPartialSource.class);

  private final File directory;
  private final String extension;

  public DirectoryPartialSource(File directory, String extension) {
    if (!directory.isDirectory())
      throw new IllegalArgumentException(directory + " is not a directory");
    this.directory = directory;
    this.extension = extension;
  }

  public DirectoryPartialSource(File directory) {
    this(directory, DEFAULT_EXTENSION);
  }

  @Override
  public String get(String name) {
    String fileName = (extension == null || extension.isEmpty()) ? name : name + "." + extension;
    File file = new File(directory, fileName);
    if (!file.isFile())
      return null;
    try {
      return getContents(file);
    } catch (IOException e) {
      LOG.warn("Could not read partial {} from {}", name, file, e);
      return null;
    }
  }

  private static String getContents(File file) throws IOException {
    StringBuilder contents = new StringBuilder();
    InputStream in = new FileInputStream(file);
    try {
      Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
      char[] buf = new char[4096];
      int n;
      while ((n = reader.read(buf)) != -1)
        contents.append(buf, 0, n);
    } finally {
      in.close();
    }
    return contents.toString();
  }
}
