package com.statecraft.core.database.dao;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import com.statecraft.core.domain.ledger.Reservation;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gson codec for the JSON columns. Maps are keyed by resource display name, e.g. {"Coal": 40.0}.
 * Decoding validates every key against {@link Resource}; a bad blob raises {@link IllegalArgumentException}.
 */
public final class ResourceJson {

    private static final Gson GSON = new Gson();

    private ResourceJson() {}

    public static String encode(ResourceMap map) {
        JsonObject obj = new JsonObject();
        if (map != null) map.forEach((r, v) -> obj.addProperty(r.displayName(), v));
        return GSON.toJson(obj);
    }

    public static ResourceMap decode(String json) {
        if (json == null || json.isBlank()) return ResourceMap.empty();
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Malformed resource map: " + json, e);
        }
        if (root.isJsonNull()) return ResourceMap.empty();
        if (!root.isJsonObject()) throw new IllegalArgumentException("Resource map is not an object: " + json);

        ResourceMap.Builder b = ResourceMap.builder();
        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject().entrySet()) {
            Resource r = Resource.require(e.getKey());
            JsonElement v = e.getValue();
            if (!v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) {
                throw new IllegalArgumentException("Quantity for " + e.getKey() + " is not a number: " + v);
            }
            b.add(r, v.getAsDouble());
        }
        return b.build();
    }

    public static String encodeReservations(List<Reservation> reservations) {
        JsonArray arr = new JsonArray();
        for (Reservation rsv : reservations) {
            JsonObject o = new JsonObject();
            o.addProperty("province_id", rsv.provinceId());
            o.add("resource", new JsonPrimitive(rsv.resource().displayName()));
            o.addProperty("amount", rsv.amount());
            arr.add(o);
        }
        return GSON.toJson(arr);
    }

    public static List<Reservation> decodeReservations(long buildId, String json) {
        List<Reservation> out = new ArrayList<>();
        if (json == null || json.isBlank()) return out;
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonArray()) return out;
        for (JsonElement el : root.getAsJsonArray()) {
            JsonObject o = el.getAsJsonObject();
            out.add(new Reservation(
                    0L,
                    buildId,
                    o.get("province_id").getAsString(),
                    Resource.require(o.get("resource").getAsString()),
                    o.get("amount").getAsDouble()
            ));
        }
        return out;
    }
}
