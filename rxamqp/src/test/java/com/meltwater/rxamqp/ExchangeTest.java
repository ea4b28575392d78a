package com.meltwater.rxamqp;

import com.meltwater.rxamqp.inmemory.InMemoryBroker;
import com.meltwater.rxamqp.inmemory.InMemoryConnection;
import com.rabbitmq.client.AMQP;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.meltwater.rxamqp.AmqpTestUtils.assertBrokerRejected;
import static com.meltwater.rxamqp.AmqpTestUtils.complete;
import static com.meltwater.rxamqp.AmqpTestUtils.errorOf;
import static com.meltwater.rxamqp.AmqpTestUtils.valueOf;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ExchangeTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    private static final AMQP.BasicProperties PROPS = new AMQP.BasicProperties.Builder()
            .messageId("msg-1")
            .deliveryMode(2)
            .build();

    private InMemoryBroker broker;
    private InMemoryConnection connection;
    private Channel channel;

    @Before
    public void setup() {
        broker = new InMemoryBroker();
        connection = broker.connect("exchange-test");
        channel = new Channel(connection);
        complete(channel.initialize());
    }

    @After
    public void teardown() {
        complete(channel.close());
    }

    private static byte[] body(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void publish_to_the_default_exchange_routes_by_queue_name() {
        valueOf(channel.declareQueue("jobs"));

        long first = valueOf(channel.getDefaultExchange().publish("jobs", PROPS, body("one"), false, 0));
        long second = valueOf(channel.getDefaultExchange().publish("jobs", PROPS, body("two"), false, 0));

        assertThat(first, is(1L));
        assertThat(second, is(2L));
        assertThat(channel.getDeliveryTag(), is(2L));
        assertThat(broker.messageCount("jobs"), is(2));
        assertThat(new String(broker.messages("jobs").get(1), StandardCharsets.UTF_8), is("two"));
    }

    @Test
    public void delivery_tags_restart_after_reopen() {
        valueOf(channel.declareQueue("jobs"));
        valueOf(channel.getDefaultExchange().publish("jobs", PROPS, body("one"), false, 0));

        complete(channel.reopen());

        assertThat(channel.getDeliveryTag(), is(0L));
        assertThat(valueOf(channel.getDefaultExchange().publish("jobs", PROPS, body("two"), false, 0)), is(1L));
    }

    @Test
    public void publish_to_declared_fanout_reaches_all_bound_queues() {
        Exchange exchange = valueOf(channel.declareExchange("events", ExchangeType.FANOUT));
        valueOf(channel.declareQueue("audit"));
        valueOf(channel.declareQueue("index"));
        broker.bind("events", "", "audit");
        broker.bind("events", "", "index");

        valueOf(exchange.publish("whatever", PROPS, body("event"), false, 0));

        assertThat(broker.messageCount("audit"), is(1));
        assertThat(broker.messageCount("index"), is(1));
    }

    @Test
    public void unroutable_mandatory_message_is_handed_to_the_return_callbacks() {
        List<IncomingMessage> returned = new CopyOnWriteArrayList<>();
        channel.getReturnCallbacks().add((ch, message) -> returned.add(message));

        valueOf(channel.getDefaultExchange().publish("nowhere", PROPS, body("lost"), true, 0));

        assertThat(returned.size(), is(1));
        IncomingMessage message = returned.get(0);
        assertThat(message.routingKey, is("nowhere"));
        assertThat(message.getMessageId(), is("msg-1"));
        assertTrue(message.noAck);
        assertThat(message.returned.replyCode, is(InMemoryBroker.NO_ROUTE));
    }

    @Test
    public void unroutable_message_without_mandatory_is_dropped() {
        List<IncomingMessage> returned = new CopyOnWriteArrayList<>();
        channel.getReturnCallbacks().add((ch, message) -> returned.add(message));

        valueOf(channel.getDefaultExchange().publish("nowhere", PROPS, body("lost"), false, 0));

        assertTrue(returned.isEmpty());
        assertThat(channel.getState(), is(ChannelState.READY));
    }

    @Test
    public void on_return_raises_fails_the_publish_of_a_returned_message() {
        Channel raising = new Channel(connection, new ChannelSettings.Builder()
                .withPublisherConfirms(true)
                .withOnReturnRaises(true)
                .build());
        complete(raising.initialize());

        Throwable error = errorOf(raising.getDefaultExchange().publish("nowhere", PROPS, body("lost"), true, 0));

        assertThat(error, instanceOf(DeliveryException.class));
        ReturnedMessage returned = ((DeliveryException) error).getReturnedMessage();
        assertThat(returned.routingKey, is("nowhere"));
        assertThat(raising.getState(), is(ChannelState.READY));
        complete(raising.close());
    }

    @Test
    public void publish_to_a_missing_exchange_is_rejected_and_closes_the_channel() {
        Exchange missing = valueOf(channel.getExchange("missing", false));

        Throwable error = errorOf(missing.publish("key", PROPS, body("x"), false, 0));

        assertBrokerRejected(error, InMemoryBroker.NOT_FOUND);
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_PEER));
    }

    @Test
    public void publish_to_an_internal_exchange_is_refused() {
        Exchange internal = valueOf(channel.declareExchange("internal.x", ExchangeType.TOPIC.value,
                true, false, true, false, null, 0));

        Throwable error = errorOf(internal.publish("key", PROPS, body("x"), false, 0));

        assertBrokerRejected(error, AMQP.ACCESS_REFUSED);
        assertTrue(broker.getExchange("internal.x").internal);
    }

    @Test
    public void declaring_the_default_exchange_does_not_contact_the_broker() {
        Exchange defaultExchange = channel.getDefaultExchange();

        assertTrue(defaultExchange.isDefault());
        assertThat(defaultExchange.type, is(ExchangeType.DIRECT.value));
        complete(defaultExchange.declare(0));
        assertThat(channel.getState(), is(ChannelState.READY));
    }

    @Test
    public void reserved_exchange_names_are_refused() {
        Throwable error = errorOf(channel.declareExchange("amq.custom", ExchangeType.DIRECT));

        assertBrokerRejected(error, AMQP.ACCESS_REFUSED);
        assertFalse(broker.exchangeExists("amq.custom"));
    }

    @Test
    public void redeclare_with_another_type_is_rejected() {
        valueOf(channel.declareExchange("logs", ExchangeType.DIRECT));

        Throwable error = errorOf(channel.declareExchange("logs", ExchangeType.FANOUT));

        assertBrokerRejected(error, InMemoryBroker.PRECONDITION_FAILED);
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_PEER));
    }

    @Test
    public void delete_removes_the_exchange() {
        Exchange exchange = valueOf(channel.declareExchange("temp", ExchangeType.TOPIC, false, true));
        assertTrue(broker.getExchange("temp").autoDelete);

        valueOf(exchange.delete(false, 0));

        assertFalse(broker.exchangeExists("temp"));
    }

    @Test
    public void exchanges_are_equal_by_channel_and_declaration() {
        Exchange first = valueOf(channel.getExchange("x", false));
        Exchange second = valueOf(channel.getExchange("x", false));
        Exchange other = valueOf(new Channel(connection).getExchange("x", false));

        assertThat(first, is(second));
        assertThat(first.hashCode(), is(second.hashCode()));
        assertThat(first, not(other));
        assertThat(first, not(valueOf(channel.getExchange("y", false))));
    }
}
