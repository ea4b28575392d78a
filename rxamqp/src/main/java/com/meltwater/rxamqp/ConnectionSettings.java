package com.meltwater.rxamqp;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.meltwater.rxamqp.util.Logger;
import com.rabbitmq.client.ConnectionFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * The tuning a {@link com.meltwater.rxamqp.impl.RabbitConnection} applies to its {@link ConnectionFactory}.
 *
 * Built with the {@link ConnectionSettings.Builder} withXX methods or from JSON in the same relaxed format as
 * {@link ChannelSettings}, e.g. {@code heartbeat_secs:5, channel_max:64}. The JSON names are the field names.
 *
 * @see <a href="https://www.rabbitmq.com/uri-query-parameters.html">AMQP uri-query-parameters</a>
 */
public class ConnectionSettings {

    private final static Logger log = new Logger(ConnectionSettings.class);
    private final static ObjectMapper mapper = new ObjectMapper();

    public static final int DEFAULT_HEARTBEAT_SECS              = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS   = 30_000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_MILLIS     = 30_000;
    public static final int DEFAULT_HANDSHAKE_TIMEOUT_MILLIS    = 10_000;
    public static final int DEFAULT_FRAME_MAX                   = 0; //no limit
    public static final int DEFAULT_CHANNEL_MAX                 = 0; //no limit

    public final static String heartbeat_secs_param             = "heartbeat_secs";
    public final static String connection_timeout_millis_param  = "connection_timeout_millis";
    public final static String shutdown_timeout_millis_param    = "shutdown_timeout_millis";
    public final static String handshake_timeout_millis_param   = "handshake_timeout_millis";
    public final static String frame_max_param                  = "frame_max";
    public final static String channel_max_param                = "channel_max";
    public final static String client_properties_param          = "client_properties";

    private final static Set<String> known_params = ImmutableSet.of(
            heartbeat_secs_param,
            connection_timeout_millis_param,
            shutdown_timeout_millis_param,
            handshake_timeout_millis_param,
            frame_max_param,
            channel_max_param,
            client_properties_param);

    public final int heartbeat_secs;
    public final int connection_timeout_millis;

    /**
     * How long closing the connection waits for the broker.
     */
    public final int shutdown_timeout_millis;
    public final int handshake_timeout_millis;
    public final int frame_max;

    /**
     * Highest channel number the connection hands out. Channels opened with an explicit number must stay below it.
     */
    public final int channel_max;

    /**
     * Extra client properties sent to the broker, shown in the management UI.
     */
    public final ImmutableMap<String, String> client_properties;

    private ConnectionSettings(Builder builder) {
        this.heartbeat_secs = builder.heartbeatSecs;
        this.connection_timeout_millis = builder.connectionTimeoutMillis;
        this.shutdown_timeout_millis = builder.shutdownTimeoutMillis;
        this.handshake_timeout_millis = builder.handshakeTimeoutMillis;
        this.frame_max = builder.frameMax;
        this.channel_max = builder.channelMax;
        this.client_properties = ImmutableMap.copyOf(builder.clientProperties);
    }

    public static ConnectionSettings defaults() {
        return new Builder().build();
    }

    /**
     * Copies the tuning into the factory. Addresses, credentials and client properties are left alone.
     */
    public ConnectionFactory applyTo(ConnectionFactory factory) {
        factory.setRequestedHeartbeat(heartbeat_secs);
        factory.setConnectionTimeout(connection_timeout_millis);
        factory.setShutdownTimeout(shutdown_timeout_millis);
        factory.setHandshakeTimeout(handshake_timeout_millis);
        factory.setRequestedFrameMax(frame_max);
        factory.setRequestedChannelMax(channel_max);
        return factory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ConnectionSettings that = (ConnectionSettings) o;

        if (heartbeat_secs != that.heartbeat_secs) return false;
        if (connection_timeout_millis != that.connection_timeout_millis) return false;
        if (shutdown_timeout_millis != that.shutdown_timeout_millis) return false;
        if (handshake_timeout_millis != that.handshake_timeout_millis) return false;
        if (frame_max != that.frame_max) return false;
        if (channel_max != that.channel_max) return false;
        return client_properties.equals(that.client_properties);
    }

    @Override
    public int hashCode() {
        int result = heartbeat_secs;
        result = 31 * result + connection_timeout_millis;
        result = 31 * result + shutdown_timeout_millis;
        result = 31 * result + handshake_timeout_millis;
        result = 31 * result + frame_max;
        result = 31 * result + channel_max;
        result = 31 * result + client_properties.hashCode();
        return result;
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private int heartbeatSecs = DEFAULT_HEARTBEAT_SECS;
        private int connectionTimeoutMillis = DEFAULT_CONNECTION_TIMEOUT_MILLIS;
        private int shutdownTimeoutMillis = DEFAULT_SHUTDOWN_TIMEOUT_MILLIS;
        private int handshakeTimeoutMillis = DEFAULT_HANDSHAKE_TIMEOUT_MILLIS;
        private int frameMax = DEFAULT_FRAME_MAX;
        private int channelMax = DEFAULT_CHANNEL_MAX;
        private Map<String, String> clientProperties = new HashMap<>();

        public Builder() {
        }

        /**
         * @param settingsJSONString the settings as JSON, the surrounding braces and the quotes around the field names may be left out.
         */
        public Builder(String settingsJSONString) {
            ObjectMapper reader = new ObjectMapper();
            reader.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
            reader.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
            String json = settingsJSONString.trim();
            if (!json.startsWith("{")) {
                json = "{" + json + "}";
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = reader.readValue(json, Map.class);
                for (Map.Entry<String, Object> entry : map.entrySet()) {
                    set(entry.getKey(), entry.getValue());
                }
            } catch (IllegalArgumentException e) {
                log.errorWithParams("Invalid connection settings.", e, "settings", settingsJSONString);
                throw e;
            } catch (Exception e) {
                log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
                throw new IllegalArgumentException(e);
            }
        }

        private void set(String key, Object value) {
            if (!known_params.contains(key)) {
                throw new IllegalArgumentException("Unknown connection setting '" + key + "'. Known settings are " + known_params);
            }
            if (client_properties_param.equals(key)) {
                if (!(value instanceof Map)) {
                    throw new IllegalArgumentException("'" + key + "' must be an object");
                }
                Map<String, String> properties = new HashMap<>();
                for (Map.Entry<?, ?> property : ((Map<?, ?>) value).entrySet()) {
                    properties.put(String.valueOf(property.getKey()), String.valueOf(property.getValue()));
                }
                withClientProperties(properties);
                return;
            }
            if (!(value instanceof Integer) || (Integer) value < 0) {
                throw new IllegalArgumentException("'" + key + "' must be a non negative integer, was " + value);
            }
            int number = (Integer) value;
            switch (key) {
                case heartbeat_secs_param: heartbeatSecs = number; break;
                case connection_timeout_millis_param: connectionTimeoutMillis = number; break;
                case shutdown_timeout_millis_param: shutdownTimeoutMillis = number; break;
                case handshake_timeout_millis_param: handshakeTimeoutMillis = number; break;
                case frame_max_param: frameMax = number; break;
                default: channelMax = number; break;
            }
        }

        public ConnectionSettings build() {
            return new ConnectionSettings(this);
        }

        public Builder withHeartbeatSecs(int heartbeatSecs) {
            assert heartbeatSecs >= 0;
            this.heartbeatSecs = heartbeatSecs;
            return this;
        }

        public Builder withConnectionTimeoutMillis(int connectionTimeoutMillis) {
            assert connectionTimeoutMillis >= 0;
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder withShutdownTimeoutMillis(int shutdownTimeoutMillis) {
            assert shutdownTimeoutMillis >= 0;
            this.shutdownTimeoutMillis = shutdownTimeoutMillis;
            return this;
        }

        public Builder withHandshakeTimeoutMillis(int handshakeTimeoutMillis) {
            assert handshakeTimeoutMillis >= 0;
            this.handshakeTimeoutMillis = handshakeTimeoutMillis;
            return this;
        }

        public Builder withFrameMax(int frameMax) {
            assert frameMax >= 0;
            this.frameMax = frameMax;
            return this;
        }

        public Builder withChannelMax(int channelMax) {
            assert channelMax >= 0;
            this.channelMax = channelMax;
            return this;
        }

        public Builder withClientProperties(Map<String, String> clientProperties) {
            assert clientProperties != null;
            this.clientProperties = new HashMap<>(clientProperties);
            return this;
        }
    }
}
