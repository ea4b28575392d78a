package com.meltwater.rxamqp;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import com.meltwater.rxamqp.util.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * The settings a {@link Channel} is created with. They are fixed for the lifetime of the channel and survive reopening it.
 *
 * This object can be built programmatically by using the various {@link ChannelSettings.Builder}
 * withXX methods or by supplying a JSON formatted String to the {@link ChannelSettings.Builder#Builder(String)} constructor.
 *
 * The available JSON parameter names are included as String constants and directly correspond to the names of the fields in this class.
 * The {@link #toString()} method shows the JSON representation of this class and can be used as input to the builder.
 */
public class ChannelSettings {

    private final static Logger log = new Logger(ChannelSettings.class);
    private final static ObjectMapper mapper = new ObjectMapper();

    public static final boolean DEFAULT_PUBLISHER_CONFIRMS      = true;
    public static final boolean DEFAULT_ON_RETURN_RAISES        = false;
    public static final int DEFAULT_OPERATION_TIMEOUT_MILLIS    = 0; //no timeout

    public final static String channel_number_param             = "channel_number";
    public final static String publisher_confirms_param         = "publisher_confirms";
    public final static String on_return_raises_param           = "on_return_raises";
    public final static String operation_timeout_millis_param   = "operation_timeout_millis";

    private final static Set<String> known_params = ImmutableSet.of(
            channel_number_param,
            publisher_confirms_param,
            on_return_raises_param,
            operation_timeout_millis_param);

    /**
     * The broker visible channel number, null means it is assigned when the channel is opened.
     */
    public final Integer channel_number;

    /**
     * Ask the broker to confirm every publish.
     */
    public final boolean publisher_confirms;

    /**
     * Fail mandatory publishes that the broker returns instead of only notifying the return callbacks.
     * Requires {@link #publisher_confirms}.
     */
    public final boolean on_return_raises;

    /**
     * Timeout used by the operations that are not given an explicit one. 0 means forever.
     */
    public final int operation_timeout_millis;

    private ChannelSettings(Integer channelNumber, boolean publisherConfirms, boolean onReturnRaises, int operationTimeoutMillis) {
        this.channel_number = channelNumber;
        this.publisher_confirms = publisherConfirms;
        this.on_return_raises = onReturnRaises;
        this.operation_timeout_millis = operationTimeoutMillis;
    }

    public static ChannelSettings defaults() {
        return new Builder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ChannelSettings that = (ChannelSettings) o;

        if (publisher_confirms != that.publisher_confirms) return false;
        if (on_return_raises != that.on_return_raises) return false;
        if (operation_timeout_millis != that.operation_timeout_millis) return false;
        return channel_number != null ? channel_number.equals(that.channel_number) : that.channel_number == null;
    }

    @Override
    public int hashCode() {
        int result = channel_number != null ? channel_number.hashCode() : 0;
        result = 31 * result + (publisher_confirms ? 1 : 0);
        result = 31 * result + (on_return_raises ? 1 : 0);
        result = 31 * result + operation_timeout_millis;
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

        private Integer channelNumber;
        private boolean publisherConfirms;
        private boolean onReturnRaises;
        private int operationTimeoutMillis;

        public Builder(){
            setDefaults(new HashMap<>());
        }

        /**
         * @param settingsJSONString the settings as JSON, the surrounding braces and the quotes around the field names may be left out.
         */
        public Builder(String settingsJSONString) {
            ObjectMapper reader = new ObjectMapper();
            reader.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
            reader.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
            String json = settingsJSONString.trim();
            if (!json.startsWith("{")){
                json = "{"+json+"}";
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = reader.readValue(json, Map.class);
                for (String key : map.keySet()) {
                    if (!known_params.contains(key)) {
                        throw new IllegalArgumentException("Unknown channel setting '" + key + "'. Known settings are " + known_params);
                    }
                }
                setDefaults(map);
            } catch (IllegalArgumentException e) {
                log.errorWithParams("Invalid channel settings.", e, "settings", settingsJSONString);
                throw e;
            } catch (Exception e){
                log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
                throw new IllegalArgumentException(e);
            }
        }

        private void setDefaults(Map<String,Object> map){
            channelNumber = (Integer) map.get(channel_number_param);
            publisherConfirms = (boolean) map.getOrDefault(publisher_confirms_param, DEFAULT_PUBLISHER_CONFIRMS);
            onReturnRaises = (boolean) map.getOrDefault(on_return_raises_param, DEFAULT_ON_RETURN_RAISES);
            operationTimeoutMillis = (int) map.getOrDefault(operation_timeout_millis_param, DEFAULT_OPERATION_TIMEOUT_MILLIS);
        }

        public ChannelSettings build() {
            return new ChannelSettings(channelNumber, publisherConfirms, onReturnRaises, operationTimeoutMillis);
        }

        public Builder withChannelNumber(Integer channelNumber) {
            assert channelNumber == null || channelNumber > 0;
            this.channelNumber = channelNumber;
            return this;
        }

        public Builder withPublisherConfirms(boolean publisherConfirms) {
            this.publisherConfirms = publisherConfirms;
            return this;
        }

        public Builder withOnReturnRaises(boolean onReturnRaises) {
            this.onReturnRaises = onReturnRaises;
            return this;
        }

        public Builder withOperationTimeoutMillis(int operationTimeoutMillis) {
            assert operationTimeoutMillis >= 0;
            this.operationTimeoutMillis = operationTimeoutMillis;
            return this;
        }
    }
}
