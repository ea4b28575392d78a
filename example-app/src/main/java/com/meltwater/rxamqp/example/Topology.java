package com.meltwater.rxamqp.example;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meltwater.rxamqp.ExchangeType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The exchanges and queues an application expects to find on the broker.
 *
 * <pre>
 * exchanges:[{name:"orders", type:"topic", durable:true}],
 * queues:[{name:"orders-audit", durable:true}]
 * </pre>
 */
public class Topology {

    public List<ExchangeDefinition> exchanges = new ArrayList<>();
    public List<QueueDefinition> queues = new ArrayList<>();

    public static class ExchangeDefinition {
        public String name;
        public String type = ExchangeType.DIRECT.value;
        public boolean durable = true;
        public boolean auto_delete = false;
        public boolean internal = false;
        public Map<String, Object> arguments = new HashMap<>();
    }

    public static class QueueDefinition {
        public String name = "";
        public boolean durable = true;
        public boolean exclusive = false;
        public boolean auto_delete = false;
        public Map<String, Object> arguments = new HashMap<>();
    }

    /**
     * @param json the topology as JSON, the surrounding braces and the quotes around the field names may be left out.
     */
    public static Topology fromJson(String json) {
        ObjectMapper reader = new ObjectMapper();
        reader.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
        reader.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
        String trimmed = json.trim();
        if (!trimmed.startsWith("{")) {
            trimmed = "{" + trimmed + "}";
        }
        try {
            Topology topology = reader.readValue(trimmed, Topology.class);
            for (ExchangeDefinition exchange : topology.exchanges) {
                if (exchange.name == null || exchange.name.isEmpty()) {
                    throw new IllegalArgumentException("Exchange definitions need a name");
                }
            }
            return topology;
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not parse topology " + json, e);
        }
    }
}
