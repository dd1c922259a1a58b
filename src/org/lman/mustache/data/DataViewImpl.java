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

import java.math.BigDecimal;

/**
 * Base {@link DataView} which supports nothing, other than truthiness and stringification built
 * on top of whatever the subclass does support.
 */
public class DataViewImpl implements DataView {

  @Override
  public Type getType() {
    throw new UnsupportedOperationException();
  }

  @Override
  public boolean asBoolean() {
    throw new UnsupportedOperationException();
  }

  @Override
  public Number asNumber() {
    throw new UnsupportedOperationException();
  }

  @Override
  public String asString() {
    throw new UnsupportedOperationException();
  }

  @Override
  public Lambda asLambda() {
    throw new UnsupportedOperationException();
  }

  @Override
  public boolean asArrayIsEmpty() {
    throw new UnsupportedOperationException();
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    throw new UnsupportedOperationException();
  }

  @Override
  public boolean asObjectIsEmpty() {
    throw new UnsupportedOperationException();
  }

  @Override
  public DataView get(String key) {
    return null;
  }

  @Override
  public boolean isTruthy() {
    return isTruthy(this);
  }

  @Override
  public String toText() {
    return toText(this);
  }

  static boolean isTruthy(DataView value) {
    switch (value.getType()) {
      case NULL:
        return false;
      case BOOLEAN:
        return value.asBoolean();
      case STRING:
        return !value.asString().isEmpty();
      case ARRAY:
        return !value.asArrayIsEmpty();
      case NUMBER:
      case OBJECT:
      case LAMBDA:
        return true;
    }
    throw new AssertionError(value.getType());
  }

  static String toText(DataView value) {
    switch (value.getType()) {
      case NULL:
        return "";
      case BOOLEAN:
        return String.valueOf(value.asBoolean());
      case NUMBER:
        return numberToText(value.asNumber());
      case STRING:
        return value.asString();
      case ARRAY:
        return value.asArrayIsEmpty() ? "" : value.toString();
      case OBJECT:
        return value.asObjectIsEmpty() ? "" : value.toString();
      case LAMBDA:
        return "";
    }
    throw new AssertionError(value.getType());
  }

  /**
   * Integers print as themselves, decimals without trailing zeros (JSON 1.210 prints as 1.21).
   */
  static String numberToText(Number number) {
    if (number instanceof BigDecimal)
      return stripZeros((BigDecimal) number);
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d))
        return number.toString();
      return stripZeros(new BigDecimal(number.toString()));
    }
    return number.toString();
  }

  private static String stripZeros(BigDecimal decimal) {
    if (decimal.signum() == 0)
      return "0";
    return decimal.stripTrailingZeros().toPlainString();
  }
}
