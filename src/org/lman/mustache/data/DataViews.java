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
import org.json.JSONObject;

/**
 * Picks the {@link DataView} for arbitrary data.
 */
public final class DataViews {

  private DataViews() {}

  public static DataView of(Object data) {
    if (data instanceof DataView)
      return (DataView) data;
    if (data instanceof JSONObject || data instanceof JSONArray || JSONObject.NULL.equals(data))
      return JSONObjectDataView.wrap(data);
    return new PojoDataView(data);
  }
}
