/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.vastgen.variation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a variant list, used as the generator's cache payload.
 *
 * <p>Scalar types survive a round trip: integers decode as {@link Long}, reals as
 * {@link Double} (Java renders every double with a decimal point or exponent), booleans
 * and strings as themselves.
 *
 * <pre>{@code
 * {"format": 1, "variants": [{"index": 0, "id": "variant-0000", "assignment": {"speed": 1.25}}]}
 * }</pre>
 */
public final class VariantListCodec {

    static final int FORMAT = 1;

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private VariantListCodec() {
    }

    public static String encode(List<Variant> variants) {
        JsonArray array = new JsonArray();
        for (Variant variant : variants) {
            JsonObject assignment = new JsonObject();
            for (Map.Entry<String, Object> e : variant.getAssignment().entrySet()) {
                assignment.add(e.getKey(), toJson(e.getValue()));
            }
            JsonObject obj = new JsonObject();
            obj.addProperty("index", variant.getIndex());
            obj.addProperty("id", variant.getId());
            obj.add("assignment", assignment);
            array.add(obj);
        }
        JsonObject root = new JsonObject();
        root.addProperty("format", FORMAT);
        root.add("variants", array);
        return GSON.toJson(root);
    }

    /**
     * @param json the encoded list
     * @return the variants in their encoded order
     * @throws JsonParseException if the text is not a variant list of a supported format
     */
    public static List<Variant> decode(String json) {
        JsonElement parsed = JsonParser.parseString(json);
        if (!parsed.isJsonObject()) {
            throw new JsonParseException("variant list must be a JSON object");
        }
        JsonObject root = parsed.getAsJsonObject();
        if (!root.has("format") || root.get("format").getAsInt() != FORMAT) {
            throw new JsonParseException("unsupported variant list format " + root.get("format"));
        }
        List<Variant> variants = new ArrayList<>();
        for (JsonElement element : root.getAsJsonArray("variants")) {
            JsonObject obj = element.getAsJsonObject();
            Map<String, Object> assignment = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject("assignment").entrySet()) {
                assignment.put(e.getKey(), fromJson(e.getKey(), e.getValue()));
            }
            variants.add(new Variant(obj.get("index").getAsInt(), obj.get("id").getAsString(), assignment));
        }
        return variants;
    }

    private static JsonElement toJson(Object value) {
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        return new JsonPrimitive(String.valueOf(value));
    }

    private static Object fromJson(String name, JsonElement element) {
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException("assignment of '" + name + "' is not a scalar");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            String text = primitive.getAsString();
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        }
        return primitive.getAsString();
    }
}
