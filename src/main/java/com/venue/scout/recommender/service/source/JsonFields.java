package com.venue.scout.recommender.service.source;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Null-tolerant accessors over Gson trees of provider responses.
 */
final class JsonFields {

    private JsonFields() {
    }

    static boolean present(JsonObject o, String key) {
        return o != null && o.has(key) && !o.get(key).isJsonNull();
    }

    static String optString(JsonObject o, String key) {
        return present(o, key) ? o.get(key).getAsString() : null;
    }

    static Double optDouble(JsonObject o, String key) {
        if (!present(o, key)) return null;
        try {
            return o.get(key).getAsDouble();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer optInt(JsonObject o, String key) {
        if (!present(o, key)) return null;
        try {
            return o.get(key).getAsInt();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static JsonObject optObject(JsonObject o, String key) {
        return present(o, key) && o.get(key).isJsonObject() ? o.getAsJsonObject(key) : null;
    }

    static JsonArray optArray(JsonObject o, String key) {
        return present(o, key) && o.get(key).isJsonArray() ? o.getAsJsonArray(key) : new JsonArray();
    }

    /** First element of an array member as an object, or null. */
    static JsonObject firstObject(JsonObject o, String key) {
        JsonArray arr = optArray(o, key);
        if (arr.isEmpty()) return null;
        JsonElement first = arr.get(0);
        return first.isJsonObject() ? first.getAsJsonObject() : null;
    }
}
