package com.nevis.hybrid.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain JSON mapping for {@link MetadataValue}: no type tags on the wire.
 */
public final class MetadataValueJson {

    private MetadataValueJson() {
    }

    public static MetadataValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MetadataValue.NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new MetadataValue.StringValue(node.textValue());
        }
        if (node.isNumber()) {
            return new MetadataValue.NumberValue(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new MetadataValue.BooleanValue(node.booleanValue());
        }
        if (node.isArray()) {
            List<MetadataValue> values = new ArrayList<>(node.size());
            node.forEach(element -> values.add(fromNode(element)));
            return new MetadataValue.ListValue(values);
        }
        if (node.isObject()) {
            Map<String, MetadataValue> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), fromNode(field.getValue()));
            }
            return new MetadataValue.MapValue(values);
        }
        throw new IllegalArgumentException("Unsupported JSON node for metadata: " + node.getNodeType());
    }

    static void write(MetadataValue value, JsonGenerator gen) throws IOException {
        if (value instanceof MetadataValue.StringValue s) {
            gen.writeString(s.value());
        } else if (value instanceof MetadataValue.NumberValue n) {
            gen.writeNumber(n.value());
        } else if (value instanceof MetadataValue.BooleanValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof MetadataValue.NullValue) {
            gen.writeNull();
        } else if (value instanceof MetadataValue.ListValue list) {
            gen.writeStartArray();
            for (MetadataValue element : list.values()) {
                write(element, gen);
            }
            gen.writeEndArray();
        } else if (value instanceof MetadataValue.MapValue map) {
            gen.writeStartObject();
            for (Map.Entry<String, MetadataValue> entry : map.values().entrySet()) {
                gen.writeFieldName(entry.getKey());
                write(entry.getValue(), gen);
            }
            gen.writeEndObject();
        }
    }

    public static class Serializer extends StdSerializer<MetadataValue> {

        public Serializer() {
            super(MetadataValue.class);
        }

        @Override
        public void serialize(MetadataValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            write(value, gen);
        }
    }

    public static class Deserializer extends StdDeserializer<MetadataValue> {

        public Deserializer() {
            super(MetadataValue.class);
        }

        @Override
        public MetadataValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            return fromNode(node);
        }

        @Override
        public MetadataValue getNullValue(DeserializationContext ctxt) {
            return MetadataValue.NullValue.INSTANCE;
        }
    }
}
