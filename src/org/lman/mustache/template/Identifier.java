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
import java.util.Deque;
import java.util.List;

import org.lman.mustache.data.DataView;

/**
 * A name in a tag: either just '.' to refer to the innermost context, or foo.bar.baz. The empty
 * name is never found.
 */
final class Identifier {
  private final String name;
  private final boolean isThis;
  private final String[] path;

  Identifier(String name) {
    this.name = name;
    this.isThis = name.equals(".");
    this.path = isThis ? new String[0] : split(name);
  }

  private static String[] split(String dotSeparatedPath) {
    List<String> path = new ArrayList<String>();
    StringBuilder next = new StringBuilder();
    for (int i = 0; i < dotSeparatedPath.length(); i++) {
      char c = dotSeparatedPath.charAt(i);
      if (c == '.') {
        path.add(next.toString());
        next = new StringBuilder();
      } else {
        next.append(c);
      }
    }
    path.add(next.toString());
    return path.toArray(new String[path.size()]);
  }

  /**
   * Resolves against |contexts|, innermost first. Only the first segment is looked for in
   * every context; the first context that has it wins, and the rest of the path must then be
   * found inside that value. Returns null if the name can't be resolved.
   */
  DataView resolve(Deque<DataView> contexts) {
    if (isThis)
      return contexts.peekFirst();
    if (name.isEmpty())
      return null;

    DataView resolved = null;
    for (DataView context : contexts) {
      resolved = context.get(path[0]);
      if (resolved != null)
        break;
    }

    for (int i = 1; i < path.length && resolved != null; i++)
      resolved = resolved.get(path[i]);
    return resolved;
  }

  @Override
  public String toString() {
    return name;
  }
}
