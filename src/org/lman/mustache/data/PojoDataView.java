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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A view over a plain Java object. Maps and objects with public fields are {@link Type#OBJECT}s,
 * arrays and {@link Iterable}s are {@link Type#ARRAY}s. Views hold no state beyond the object
 * itself, so one can be shared between concurrent renders as long as the object isn't mutated.
 */
public class PojoDataView extends DataViewImpl {

  private final Object pojo;
  private final Type type;

  public PojoDataView(Object pojo) {
    this.pojo = pojo;
    this.type = typeOf(pojo);
  }

  private static Type typeOf(Object pojo) {
    if (pojo == null)
      return Type.NULL;
    else if (pojo instanceof Boolean)
      return Type.BOOLEAN;
    else if (pojo instanceof Number)
      return Type.NUMBER;
    else if (pojo instanceof Enum ||
             pojo instanceof CharSequence ||
             pojo instanceof Character)
      return Type.STRING;
    else if (pojo instanceof Lambda)
      return Type.LAMBDA;
    else if (pojo.getClass().isArray() || pojo instanceof Iterable)
      return Type.ARRAY;
    else
      return Type.OBJECT;
  }

  @Override
  public Type getType() {
    return type;
  }

  @Override
  public boolean asBoolean() {
    checkIsType(Type.BOOLEAN);
    return ((Boolean) pojo).booleanValue();
  }

  @Override
  public Number asNumber() {
    checkIsType(Type.NUMBER);
    return (Number) pojo;
  }

  @Override
  public String asString() {
    checkIsType(Type.STRING);
    if (pojo instanceof Enum)
      return ((Enum<?>) pojo).name();
    return pojo.toString();
  }

  @Override
  public Lambda asLambda() {
    checkIsType(Type.LAMBDA);
    return (Lambda) pojo;
  }

  @Override
  public boolean asArrayIsEmpty() {
    checkIsType(Type.ARRAY);
    if (pojo.getClass().isArray())
      return Array.getLength(pojo) == 0;
    return !((Iterable<?>) pojo).iterator().hasNext();
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    checkIsType(Type.ARRAY);
    if (pojo.getClass().isArray()) {
      for (int i = 0, length = Array.getLength(pojo); i < length; i++)
        visitor.visit(DataViews.of(Array.get(pojo, i)), i);
    } else {
      int i = 0;
      for (Object value : (Iterable<?>) pojo)
        visitor.visit(DataViews.of(value), i++);
    }
  }

  @Override
  public boolean asObjectIsEmpty() {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map)
      return ((Map<?, ?>) pojo).isEmpty();
    for (Field f : pojo.getClass().getFields()) {
      if (Modifier.isStatic(f.getModifiers()))
        continue;
      return false;
    }
    return true;
  }

  @Override
  public DataView get(String key) {
    switch (type) {
      case OBJECT:
        return getMember(key);
      case ARRAY:
        return getIndex(key);
      default:
        return null;
    }
  }

  private DataView getMember(String key) {
    if (pojo instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) pojo;
      if (!map.containsKey(key))
        return null;
      return DataViews.of(map.get(key));
    }
    try {
      Field field = pojo.getClass().getField(key);
      if (Modifier.isStatic(field.getModifiers()))
        return null;
      return DataViews.of(field.get(pojo));
    } catch (NoSuchFieldException e) {
      return null;
    } catch (IllegalAccessException e) {
      throw new UnsupportedOperationException(e);
    }
  }

  private DataView getIndex(String key) {
    int index = parseIndex(key);
    if (index < 0)
      return null;
    if (pojo.getClass().isArray()) {
      if (index >= Array.getLength(pojo))
        return null;
      return DataViews.of(Array.get(pojo, index));
    }
    if (pojo instanceof List) {
      List<?> list = (List<?>) pojo;
      return index < list.size() ? DataViews.of(list.get(index)) : null;
    }
    Iterator<?> it = ((Iterable<?>) pojo).iterator();
    for (int i = 0; it.hasNext(); i++) {
      Object value = it.next();
      if (i == index)
        return DataViews.of(value);
    }
    return null;
  }

  /**
   * Returns the list index that |key| spells out, or -1 if it isn't one.
   */
  static int parseIndex(String key) {
    if (key.isEmpty() || key.length() > 9)
      return -1;
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (c < '0' || c > '9')
        return -1;
    }
    return Integer.parseInt(key);
  }

  private void checkIsType(Type t) {
    if (getType() != t)
      throw new UnsupportedOperationException("Expected type " + t + " but was " + getType());
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (o == null || o.getClass() != getClass())
      return false;
    PojoDataView other = (PojoDataView) o;
    if (pojo == null)
      return other.pojo == null;
    else
      return pojo.equals(other.pojo);
  }

  @Override
  public int hashCode() {
    return pojo == null ? 0 : pojo.hashCode();
  }

  @Override
  public String toString() {
    return pojo + "";
  }

}
