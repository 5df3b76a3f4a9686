package uz.legalclinic.bot.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

public final class JsonUtils {
    private JsonUtils() {}

    public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static JsonObject parseObj(String s) {
        if (s == null || s.isBlank()) return new JsonObject();
        try {
            JsonObject o = GSON.fromJson(s, JsonObject.class);
            return o == null ? new JsonObject() : o;
        } catch (JsonParseException e) {
            return new JsonObject();
        }
    }

    /**
     * Walks a dotted path ({@code "errors.general"}) through nested objects.
     * Returns null when any segment is missing or the leaf is not a string.
     */
    public static String stringAt(JsonObject root, String dottedPath) {
        if (root == null || dottedPath == null) return null;
        JsonElement cur = root;
        for (String segment : dottedPath.split("\\.")) {
            if (cur == null || !cur.isJsonObject()) return null;
            cur = cur.getAsJsonObject().get(segment);
        }
        if (cur == null || !cur.isJsonPrimitive() || !cur.getAsJsonPrimitive().isString()) return null;
        return cur.getAsString();
    }
}
