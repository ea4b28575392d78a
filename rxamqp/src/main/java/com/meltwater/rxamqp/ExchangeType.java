package com.meltwater.rxamqp;

/**
 * The exchange types known by RabbitMQ, including the common plugin types.
 */
public enum ExchangeType {
    FANOUT("fanout"),
    DIRECT("direct"),
    TOPIC("topic"),
    HEADERS("headers"),
    X_DELAYED_MESSAGE("x-delayed-message"),
    X_CONSISTENT_HASH("x-consistent-hash");

    public final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    public static ExchangeType fromValue(String value) {
        for (ExchangeType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown exchange type '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
