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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Looks a partial up in several sources in turn; the first source that has it wins. Typically an
 * in-memory {@link MapPartialSource} in front of a {@link DirectoryPartialSource}.
 */
public class ChainedPartialSource implements PartialSource {

  private final List<PartialSource> sources;

  public ChainedPartialSource(PartialSource... sources) {
    this.sources = new ArrayList<PartialSource>(Arrays.asList(sources));
    if (this.sources.contains(null))
      throw new IllegalArgumentException("Partial sources cannot be null");
  }

  @Override
  public String get(String name) {
    for (PartialSource source : sources) {
      String template = source.get(name);
      if (template != null)
        return template;
    }
    return null;
  }
}
