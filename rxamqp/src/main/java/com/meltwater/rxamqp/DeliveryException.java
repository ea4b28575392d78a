package com.meltwater.rxamqp;

import java.io.IOException;

/**
 * Signals that the broker returned a mandatory message as unroutable on a channel
 * created with {@link ChannelSettings#on_return_raises}.
 */
public class DeliveryException extends IOException {

    private final ReturnedMessage returnedMessage;

    public DeliveryException(ReturnedMessage returnedMessage) {
        super("Message was returned by the broker. replyCode=" + returnedMessage.replyCode + ", replyText=" + returnedMessage.replyText);
        this.returnedMessage = returnedMessage;
    }

    public ReturnedMessage getReturnedMessage() {
        return returnedMessage;
    }
}
