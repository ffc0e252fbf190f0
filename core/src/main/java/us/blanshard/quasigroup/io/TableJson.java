/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.quasigroup.io;

import us.blanshard.quasigroup.analysis.Analysis;
import us.blanshard.quasigroup.core.CayleyTable;

import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

/**
 * Converts Cayley tables and analyses to and from json.  A table looks like
 * {@code {"order":3,"rows":[[0,1,2],[1,2,0],[2,0,1]]}}; an analysis like
 * {@code {"proper":true,"nonTrivial":false}}.
 *
 * @author Luke Blanshard
 */
public final class TableJson {
  private TableJson() {}

  /** A convenience for reading/writing tables and analyses. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that tables and analyses
   * can be serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(CayleyTable.class, new TypeAdapter<CayleyTable>() {
      @Override public void write(JsonWriter out, CayleyTable value) throws IOException {
        out.beginObject();
        out.name("order").value(value.order());
        out.name("rows").beginArray();
        for (int row = 0; row < value.order(); ++row) {
          out.beginArray();
          for (int entry : value.row(row))
            out.value(entry);
          out.endArray();
        }
        out.endArray();
        out.endObject();
      }
      @Override public CayleyTable read(JsonReader in) throws IOException {
        int order = -1;
        List<int[]> rows = null;
        CayleyTable nested = null;
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("order")) {
            order = in.nextInt();
          } else if (name.equals("rows")) {
            rows = Lists.newArrayList();
            in.beginArray();
            while (in.hasNext()) {
              List<Integer> row = Lists.newArrayList();
              in.beginArray();
              while (in.hasNext())
                row.add(in.nextInt());
              in.endArray();
              rows.add(Ints.toArray(row));
            }
            in.endArray();
          } else if (name.equals("table")) {
            nested = read(in);
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        if (nested != null && rows == null)
          return nested;
        if (rows == null)
          throw new JsonParseException("table has no rows");
        if (order >= 0 && order != rows.size())
          throw new JsonParseException("order " + order + " but " + rows.size() + " rows");
        try {
          return CayleyTable.of(rows.toArray(new int[rows.size()][]));
        } catch (IllegalArgumentException e) {
          throw new JsonParseException(e.getMessage(), e);
        }
      }
    });

    builder.registerTypeAdapter(Analysis.class, new TypeAdapter<Analysis>() {
      @Override public void write(JsonWriter out, Analysis value) throws IOException {
        out.beginObject();
        out.name("proper").value(value.hasProper);
        out.name("nonTrivial").value(value.hasNonTrivial);
        out.endObject();
      }
      @Override public Analysis read(JsonReader in) throws IOException {
        boolean proper = false;
        boolean nonTrivial = false;
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("proper")) {
            proper = in.nextBoolean();
          } else if (name.equals("nonTrivial")) {
            nonTrivial = in.nextBoolean();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        return new Analysis(proper, nonTrivial);
      }
    });

    return builder;
  }

  public static String toJson(CayleyTable table) {
    return GSON.toJson(table);
  }

  /** Returns a json object holding both the table and its analysis. */
  public static String reportToJson(CayleyTable table, Analysis analysis) {
    JsonObject object = new JsonObject();
    object.add("table", GSON.toJsonTree(table));
    object.add("analysis", GSON.toJsonTree(analysis));
    return GSON.toJson(object);
  }

  /**
   * Parses a table from json.  Also accepts the output of {@link
   * #reportToJson}, returning the report's table.
   *
   * @throws JsonParseException if the json is malformed or doesn't describe
   *     a valid table
   */
  public static CayleyTable tableFromJson(String json) {
    return GSON.fromJson(json, CayleyTable.class);
  }
}
