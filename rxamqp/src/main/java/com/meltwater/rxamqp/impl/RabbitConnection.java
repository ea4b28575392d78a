package com.meltwater.rxamqp.impl;

import com.rabbitmq.client.impl.AMQConnection;
import com.meltwater.rxamqp.AmqpConnection;
import com.meltwater.rxamqp.BrokerAddresses;
import com.meltwater.rxamqp.ConnectionSettings;
import com.meltwater.rxamqp.Transport;
import com.meltwater.rxamqp.UnderlayChannel;
import com.meltwater.rxamqp.util.Logger;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import rx.Completable;
import rx.functions.Action2;
import rx.subjects.BehaviorSubject;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * An {@link AmqpConnection} to a RabbitMQ broker using the java amqp client.
 *
 * {@link #connect()} tries the {@link BrokerAddresses} in order and uses the first one that accepts the connection.
 * Automatic recovery of the amqp client is disabled, a lost connection has to be connected again by the application.
 */
public class RabbitConnection implements AmqpConnection, Transport {

    private static final Logger log = new Logger(RabbitConnection.class);

    private final BrokerAddresses addresses;
    private final ConnectionSettings settings;
    private final String name;

    private final BehaviorSubject<Boolean> connected = BehaviorSubject.create(false);
    private volatile Connection connection;
    private volatile DateTime startTime;

    public RabbitConnection(BrokerAddresses addresses, ConnectionSettings settings, String name) {
        this.addresses = addresses;
        this.settings = settings;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public DateTime getStartTime() {
        return startTime;
    }

    public boolean isOpen() {
        Connection current = connection;
        return current != null && current.isOpen();
    }

    /**
     * Connects to the first reachable broker. Does nothing if already connected.
     *
     * @throws IOException with the error of the last address tried if no broker could be reached
     */
    public synchronized RabbitConnection connect() throws IOException, TimeoutException {
        if (isOpen()) {
            return this;
        }
        DateTime connectTime = new DateTime(DateTimeZone.UTC);
        Map<String, Object> clientProperties = new HashMap<>(settings.client_properties);
        clientProperties.put("app_id", name);
        clientProperties.put("name", name);
        clientProperties.put("connect_time", connectTime.toString());

        Exception lastError = null;
        for (URI uri : addresses) {
            String address = BrokerAddresses.redacted(uri);
            ConnectionFactory cf = settings.applyTo(BrokerAddresses.configure(uri, new ConnectionFactory()));
            cf.setClientProperties(clientProperties);
            cf.setAutomaticRecoveryEnabled(false);
            cf.setTopologyRecoveryEnabled(false);
            try {
                Connection newConnection = cf.newConnection(name);
                newConnection.addShutdownListener(cause -> {
                    log.infoWithParams("Connection shut down.",
                            "name", name,
                            "address", address,
                            "initiatedByApplication", cause.isInitiatedByApplication(),
                            "reason", cause.getMessage());
                    connected.onNext(false);
                });
                connection = newConnection;
                startTime = connectTime;
                log.infoWithParams("Successfully created connection to broker.",
                        "address", address,
                        "localPort", ((AMQConnection) newConnection).getLocalPort(),
                        "name", name,
                        "connectTime", connectTime,
                        "settings", settings);
                connected.onNext(true);
                return this;
            } catch (IOException | TimeoutException e) {
                log.warnWithParams("Failed to connect to broker.", e,
                        "address", address,
                        "name", name);
                lastError = e;
            }
        }
        if (lastError instanceof TimeoutException) {
            throw (TimeoutException) lastError;
        }
        throw (IOException) lastError;
    }

    @Override
    public Completable connected() {
        return connected.filter(isConnected -> isConnected).first().toCompletable();
    }

    @Override
    public Transport getTransport() {
        if (!isOpen()) {
            throw new IllegalStateException("Connection " + name + " is not established");
        }
        return this;
    }

    @Override
    public UnderlayChannel openChannel(Action2<UnderlayChannel, Throwable> onClose,
                                       boolean publisherConfirms,
                                       boolean onReturnRaises,
                                       Integer channelNumber) throws IOException {
        Connection current = connection;
        if (current == null) {
            throw new IOException("Connection " + name + " is not established");
        }
        com.rabbitmq.client.Channel channel = channelNumber == null
                ? current.createChannel()
                : current.createChannel(channelNumber);
        if (channel == null) {
            throw new IOException("No channel available on connection " + name + (channelNumber == null ? "" : " with number " + channelNumber));
        }
        return new RabbitUnderlayChannel(channel, onClose, publisherConfirms, onReturnRaises);
    }

    /**
     * Closes the connection and with it all of its channels.
     */
    public synchronized void close() {
        Connection current = connection;
        if (current == null) {
            return;
        }
        final boolean connectionIsOpen = current.isOpen();
        if (connectionIsOpen) {
            try {
                current.close(settings.shutdown_timeout_millis);
            } catch (Exception e) {
                log.warnWithParams("Unexpected error when closing connection.", e,
                        "wasOpen", connectionIsOpen,
                        "isOpen", current.isOpen());
            }
        }
        connected.onNext(false);
        log.infoWithParams("Closed and disposed connection.",
                "name", name,
                "connectTime", startTime,
                "wasOpen", connectionIsOpen);
    }

    @Override
    public String toString() {
        return "RabbitConnection{" +
                "name='" + name + '\'' +
                ", addresses=" + addresses +
                ", open=" + isOpen() +
                '}';
    }
}
