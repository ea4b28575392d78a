package com.meltwater.rxamqp.example;

import com.meltwater.rxamqp.BrokerAddresses;
import com.meltwater.rxamqp.Channel;
import com.meltwater.rxamqp.ChannelSettings;
import com.meltwater.rxamqp.ConnectionSettings;
import com.meltwater.rxamqp.Queue;
import com.meltwater.rxamqp.impl.ChannelReopenHandler;
import com.meltwater.rxamqp.impl.RabbitConnection;
import com.meltwater.rxamqp.util.FibonacciBackoffAlgorithm;
import com.meltwater.rxamqp.util.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

/**
 * An example app which declares the topology from its properties file on a RabbitMQ broker.
 *
 * All properties can be overridden with system properties, e.g. {@code -Drabbit.broker.uris=amqp://rabbit:5672}.
 */
public class ExampleTopologyApp {

    private static final Logger log = new Logger(ExampleTopologyApp.class);

    public static void main(String[] args) throws IOException, TimeoutException {
        Properties prop = new Properties();
        prop.load(ExampleTopologyApp.class.getResourceAsStream("/example_app.properties"));
        prop.putAll(System.getProperties());

        ExampleTopologyApp app = new ExampleTopologyApp(
                new BrokerAddresses(prop.getProperty("rabbit.broker.uris")),
                new ConnectionSettings.Builder(prop.getProperty("rabbit.connection.settings")).build(),
                new ChannelSettings.Builder(prop.getProperty("rabbit.channel.settings")).build(),
                Topology.fromJson(prop.getProperty("rabbit.topology")));

        List<Queue> queues = app.run();
        log.infoWithParams("Topology declared.", "queues", queues.size());
    }

    private final BrokerAddresses addresses;
    private final ConnectionSettings connectionSettings;
    private final ChannelSettings channelSettings;
    private final Topology topology;

    public ExampleTopologyApp(BrokerAddresses addresses,
                              ConnectionSettings connectionSettings,
                              ChannelSettings channelSettings,
                              Topology topology) {
        this.addresses = addresses;
        this.connectionSettings = connectionSettings;
        this.channelSettings = channelSettings;
        this.topology = topology;
    }

    List<Queue> run() throws IOException, TimeoutException {
        RabbitConnection connection = new RabbitConnection(addresses, connectionSettings, "example-topology-app").connect();
        try {
            Channel channel = new Channel(connection, channelSettings);
            ChannelReopenHandler reopenHandler = new ChannelReopenHandler(channel, new FibonacciBackoffAlgorithm(), 5).start();
            try {
                return new TopologyDeclarer(channel).declare(topology).toBlocking().value();
            } finally {
                reopenHandler.stop();
            }
        } finally {
            connection.close();
        }
    }
}
