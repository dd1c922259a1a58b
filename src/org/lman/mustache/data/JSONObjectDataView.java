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

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * A view of parsed JSON text.
 *
 * @author kalman
 *
 */
public class JSONObjectDataView extends DataViewImpl {

  static class JSONArrayDataView extends DataViewImpl {
    private final JSONArray array;

    JSONArrayDataView(JSONArray array) {
      this.array = array;
    }

    @Override
    public Type getType() {
      return Type.ARRAY;
    }

    @Override
    public boolean asArrayIsEmpty() {
      return array.length() == 0;
    }

    @Override
    public void asArrayForeach(ArrayVisitor visitor) {
      for (int i = 0, length = array.length(); i < length; i++)
        visitor.visit(wrap(array.opt(i)), i);
    }

    @Override
    public DataView get(String key) {
      int index = PojoDataView.parseIndex(key);
      if (index < 0 || index >= array.length())
        return null;
      return wrap(array.opt(index));
    }

    @Override
    public String toString() {
      return array.toString();
    }
  }

  private final JSONObject json;

  public JSONObjectDataView(JSONObject json) {
    this.json = json;
  }

  /**
   * Parses JSON text, either an object or an array, into a view.
   */
  public static DataView fromJson(String text) throws JSONException {
    return wrap(new JSONTokener(text).nextValue());
  }

  /**
   * Wraps a value taken out of a {@link JSONObject} or {@link JSONArray}.
   */
  static DataView wrap(Object item) {
    if (item instanceof JSONObject)
      return new JSONObjectDataView((JSONObject) item);
    else if (item instanceof JSONArray)
      return new JSONArrayDataView((JSONArray) item);
    else if (item == null || JSONObject.NULL.equals(item))
      return new PojoDataView(null);
    else
      return DataViews.of(item);
  }

  @Override
  public Type getType() {
    return Type.OBJECT;
  }

  @Override
  public boolean asObjectIsEmpty() {
    return json.isEmpty();
  }

  @Override
  public DataView get(String key) {
    if (!json.has(key))
      return null;
    return wrap(json.opt(key));
  }

  @Override
  public String toString() {
    return json.toString();
  }

}
