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

package org.lman.mustache.data;

/**
 * A read-only view over a value in a template's data context.
 *
 * Every value a template can see is exactly one of the {@link Type}s; the typed accessors throw
 * {@link UnsupportedOperationException} when called on a view of another type.
 *
 * @author kalman
 *
 */
public interface DataView {

  interface ArrayVisitor {
    void visit(DataView value, int index);
  }

  enum Type {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    LAMBDA
  }

  Type getType();

  // Cast operations to non-collections.
  boolean asBoolean();
  Number asNumber();
  String asString();
  Lambda asLambda();

  // Operations over collections.
  boolean asArrayIsEmpty();
  void asArrayForeach(ArrayVisitor visitor);
  boolean asObjectIsEmpty();

  /**
   * Looks up a single key (no dots) directly within this value. Returns null if there is no such
   * key, and a {@link Type#NULL} view if the key is there but its value is null.
   */
  DataView get(String key);

  /**
   * Whether a section over this value renders. Null, false, empty lists and empty strings don't.
   */
  boolean isTruthy();

  /**
   * The text that interpolating this value produces, before any escaping.
   */
  String toText();
}
