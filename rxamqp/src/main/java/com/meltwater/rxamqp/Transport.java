package com.meltwater.rxamqp;

import rx.functions.Action2;

import java.io.IOException;

/**
 * A live connection to the broker that underlying channels can be opened on.
 */
public interface Transport {

    /**
     * Opens a new protocol channel.
     *
     * @param onClose called once when the channel closes, with the close reason or null for a clean close
     * @param publisherConfirms put the channel in confirm mode
     * @param onReturnRaises make mandatory publishes fail when the broker returns them
     * @param channelNumber the channel number to use, or null to let the connection pick one
     *
     * @return the opened channel
     */
    UnderlayChannel openChannel(Action2<UnderlayChannel, Throwable> onClose,
                                boolean publisherConfirms,
                                boolean onReturnRaises,
                                Integer channelNumber) throws IOException;
}
