package org.brighted.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.ResourceKind;
import org.brighted.store.api.StoreException;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON encoding of the documents kept in store columns (snapshots, effect lists, payloads).
 * <p>
 * Effects are written as {@code {"kind":"inventory","itemId":"stock","amount":-2}}, using
 * {@link ResourceKind#wireName()}; instants as ISO-8601 strings.
 */
public final class StateJsonCodec {

    static final Type EFFECT_LIST = new TypeToken<List<ResourceEffect>>() {}.getType();
    static final Type INT_MAP = new TypeToken<Map<String, Integer>>() {}.getType();
    static final Type PAYLOAD = new TypeToken<Map<String, Object>>() {}.getType();
    static final Type STRING_LIST = new TypeToken<List<String>>() {}.getType();
    static final Type STRING_SET = new TypeToken<Set<String>>() {}.getType();

    private final Gson gson;

    public StateJsonCodec() {
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Instant.class, new TypeAdapter<Instant>() {
                    @Override
                    public void write(JsonWriter out, Instant value) throws IOException {
                        if (value == null) {
                            out.nullValue();
                        } else {
                            out.value(value.toString());
                        }
                    }

                    @Override
                    public Instant read(JsonReader in) throws IOException {
                        if (in.peek() == JsonToken.NULL) {
                            in.nextNull();
                            return null;
                        }
                        return Instant.parse(in.nextString());
                    }
                })
                .registerTypeHierarchyAdapter(ResourceEffect.class, new EffectAdapter())
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                .create();
    }

    public String toJson(Object value) {
        return gson.toJson(value);
    }

    public <T> T fromJson(String json, Class<T> type) {
        return fromJson(json, (Type) type);
    }

    public <T> T fromJson(String json, Type type) {
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new StoreException("Corrupt stored document for " + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }

    public String effectsToJson(List<ResourceEffect> effects) {
        return gson.toJson(effects, EFFECT_LIST);
    }

    public List<ResourceEffect> effectsFromJson(String json) {
        return fromJson(json, EFFECT_LIST);
    }

    private static final class EffectAdapter extends TypeAdapter<ResourceEffect> {

        @Override
        public void write(JsonWriter out, ResourceEffect effect) throws IOException {
            out.beginObject();
            out.name("kind").value(effect.kind().wireName());
            if (effect instanceof ResourceEffect.Inventory inv) {
                out.name("itemId").value(inv.itemId());
            } else if (effect instanceof ResourceEffect.Reputation rep) {
                out.name("actorId").value(rep.actorId());
            }
            out.name("amount").value(effect.amount());
            out.endObject();
        }

        @Override
        public ResourceEffect read(JsonReader in) throws IOException {
            JsonObject obj = JsonParser.parseReader(in).getAsJsonObject();
            if (!obj.has("kind") || !obj.has("amount")) {
                throw new JsonParseException("Effect requires 'kind' and 'amount': " + obj);
            }
            ResourceKind kind = ResourceKind.fromWireName(obj.get("kind").getAsString());
            int amount = obj.get("amount").getAsInt();
            return switch (kind) {
                case CURRENCY -> ResourceEffect.currency(amount);
                case TIME_UNITS -> ResourceEffect.timeUnits(amount);
                case ENERGY -> ResourceEffect.energy(amount);
                case INVENTORY -> ResourceEffect.inventory(obj.get("itemId").getAsString(), amount);
                case REPUTATION -> ResourceEffect.reputation(obj.get("actorId").getAsString(), amount);
            };
        }
    }
}
