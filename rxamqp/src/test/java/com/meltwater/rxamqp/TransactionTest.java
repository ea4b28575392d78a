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
import java.util.concurrent.TimeUnit;

import static com.meltwater.rxamqp.AmqpTestUtils.complete;
import static com.meltwater.rxamqp.AmqpTestUtils.errorOf;
import static com.meltwater.rxamqp.AmqpTestUtils.valueOf;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TransactionTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    private InMemoryBroker broker;
    private Channel channel;

    @Before
    public void setup() {
        broker = new InMemoryBroker();
        InMemoryConnection connection = broker.connect("tx-test");
        channel = new Channel(connection, new ChannelSettings.Builder().withPublisherConfirms(false).build());
        complete(channel.initialize());
        valueOf(channel.declareQueue("orders"));
    }

    @After
    public void teardown() {
        complete(channel.close());
    }

    private void publish(String text) {
        valueOf(channel.getDefaultExchange().publish("orders", new AMQP.BasicProperties(),
                text.getBytes(StandardCharsets.UTF_8), false, 0));
    }

    @Test
    public void commit_delivers_the_messages_published_in_the_transaction() {
        Transaction tx = channel.transaction();
        complete(tx.select(0));
        assertThat(tx.getState(), is(Transaction.State.STARTED));

        publish("first");
        publish("second");
        assertThat(broker.messageCount("orders"), is(0));

        complete(tx.commit(0));

        assertThat(tx.getState(), is(Transaction.State.COMMITED));
        assertThat(broker.messageCount("orders"), is(2));
    }

    @Test
    public void rollback_discards_the_messages_published_in_the_transaction() {
        Transaction tx = channel.transaction();
        complete(tx.select(0));
        publish("first");

        complete(tx.rollback(0));

        assertThat(tx.getState(), is(Transaction.State.ROLLED_BACK));
        assertThat(broker.messageCount("orders"), is(0));
    }

    @Test
    public void channel_stays_transactional_after_commit() {
        Transaction tx = channel.transaction();
        complete(tx.select(0));
        publish("first");
        complete(tx.commit(0));

        publish("second");
        assertThat(broker.messageCount("orders"), is(1));
        complete(tx.commit(0));

        assertThat(broker.messageCount("orders"), is(2));
    }

    @Test
    public void commit_before_select_fails_without_contacting_the_broker() {
        Transaction tx = channel.transaction();

        Throwable error = errorOf(tx.commit(0));

        assertThat(error, instanceOf(IllegalStateException.class));
        assertThat(tx.getState(), is(Transaction.State.CREATED));
        assertThat(channel.getState(), is(ChannelState.READY));
    }

    @Test
    public void rollback_before_select_fails() {
        assertThat(errorOf(channel.transaction().rollback(0)), instanceOf(IllegalStateException.class));
    }

    @Test
    public void transaction_on_a_closed_channel_fails_with_closed() {
        Transaction tx = channel.transaction();
        complete(channel.close());

        Throwable error = errorOf(tx.select(0));

        assertThat(AmqpTestUtils.lifecycleReason(error), is(ChannelLifecycleException.Reason.CLOSED));
        assertTrue(channel.isClosed());
    }
}
