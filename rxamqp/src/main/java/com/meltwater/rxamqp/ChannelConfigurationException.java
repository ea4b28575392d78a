package com.meltwater.rxamqp;

/**
 * Thrown when a channel is configured or used with settings that can not be combined,
 * for example return raising without publisher confirms, or a transaction on a confirming channel.
 *
 * The channel itself is never affected by this error.
 */
public class ChannelConfigurationException extends RuntimeException {

    public ChannelConfigurationException(String message) {
        super(message);
    }
}
