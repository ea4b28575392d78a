package com.meltwater.rxamqp.example;

import com.meltwater.rxamqp.Channel;
import com.meltwater.rxamqp.ChannelScope;
import com.meltwater.rxamqp.Queue;
import com.meltwater.rxamqp.util.Logger;
import rx.Completable;
import rx.Observable;
import rx.Single;

import java.util.List;

/**
 * Declares a {@link Topology} over one channel: exchanges first, then queues. The channel is opened for the
 * declaration and closed afterwards, also when the broker rejects one of the declarations.
 */
public class TopologyDeclarer {

    private static final Logger log = new Logger(TopologyDeclarer.class);

    private final Channel channel;
    private final long timeoutMillis;

    public TopologyDeclarer(Channel channel) {
        this(channel, channel.getSettings().operation_timeout_millis);
    }

    public TopologyDeclarer(Channel channel, long timeoutMillis) {
        this.channel = channel;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * @return the declared queues, with the names and counts reported by the broker
     */
    public Single<List<Queue>> declare(Topology topology) {
        return ChannelScope.single(channel, ch -> declareExchanges(ch, topology).andThen(declareQueues(ch, topology)));
    }

    private Completable declareExchanges(Channel ch, Topology topology) {
        return Observable.from(topology.exchanges)
                .concatMap(def -> ch.declareExchange(def.name, def.type, def.durable, def.auto_delete, def.internal,
                        false, def.arguments, timeoutMillis).toObservable())
                .doOnNext(exchange -> log.infoWithParams("Declared exchange.", "exchange", exchange))
                .toCompletable();
    }

    private Single<List<Queue>> declareQueues(Channel ch, Topology topology) {
        return Observable.from(topology.queues)
                .concatMap(def -> ch.declareQueue(def.name, def.durable, def.exclusive, false, def.auto_delete,
                        def.arguments, timeoutMillis).toObservable())
                .doOnNext(queue -> log.infoWithParams("Declared queue.",
                        "queue", queue.getName(),
                        "messageCount", queue.getMessageCount(),
                        "consumerCount", queue.getConsumerCount()))
                .toList()
                .toSingle();
    }
}
