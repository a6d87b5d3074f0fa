package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;

/**
 * _channels 列表中的一项：纯频道名（继承分类/全局默认值），或带保留天数覆盖的频道。
 * YAML 形式分别为 {@code - general} 与 {@code - archive: -1}。
 */
@JsonDeserialize(using = ChannelEntry.Deserializer.class)
public interface ChannelEntry {

    String name();

    static ChannelEntry plain(String name) {
        return new Plain(name);
    }

    static ChannelEntry withRetention(String name, RetentionValue days) {
        return new WithRetention(name, days);
    }

    record Plain(String name) implements ChannelEntry {
        @JsonValue
        public String toJson() {
            return name;
        }
    }

    record WithRetention(String name, RetentionValue days) implements ChannelEntry {
        @JsonValue
        public Map<String, RetentionValue> toJson() {
            return Collections.singletonMap(name, days);
        }
    }

    class Deserializer extends StdDeserializer<ChannelEntry> {

        public Deserializer() {
            super(ChannelEntry.class);
        }

        @Override
        public ChannelEntry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node.isValueNode() && !node.isNull()) {
                return new Plain(node.asText());
            }
            if (node.isObject() && node.size() == 1) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                Map.Entry<String, JsonNode> field = fields.next();
                RetentionValue days = RetentionValue.fromJson(field.getValue());
                if (days == null) {
                    return new Plain(field.getKey());
                }
                return new WithRetention(field.getKey(), days);
            }
            throw JsonMappingException.from(p,
                    "_channels entries must be a channel name or a single {name: days} mapping, got: " + node);
        }
    }
}
