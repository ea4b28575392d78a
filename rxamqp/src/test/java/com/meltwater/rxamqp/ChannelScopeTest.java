package com.meltwater.rxamqp;

import com.meltwater.rxamqp.inmemory.InMemoryBroker;
import com.meltwater.rxamqp.inmemory.InMemoryConnection;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import rx.Observable;
import rx.Single;
import rx.Subscription;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.jayway.awaitility.Awaitility.await;
import static com.meltwater.rxamqp.AmqpTestUtils.complete;
import static com.meltwater.rxamqp.AmqpTestUtils.errorOf;
import static com.meltwater.rxamqp.AmqpTestUtils.valueOf;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ChannelScopeTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    private InMemoryBroker broker;
    private InMemoryConnection connection;
    private Channel channel;
    private List<Throwable> closeReasons;

    @Before
    public void setup() {
        broker = new InMemoryBroker();
        connection = broker.connect("scope-test");
        channel = new Channel(connection);
        closeReasons = new CopyOnWriteArrayList<>();
        channel.getCloseCallbacks().add((ch, reason) -> closeReasons.add(reason));
    }

    @Test
    public void opens_on_enter_and_closes_on_exit() {
        try (ChannelScope scope = ChannelScope.open(channel)) {
            assertThat(scope.channel(), sameInstance(channel));
            assertThat(channel.getState(), is(ChannelState.READY));
            valueOf(scope.channel().declareQueue("scoped"));
        }

        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
        assertThat(closeReasons.size(), is(1));
        assertTrue(broker.queueExists("scoped"));
    }

    @Test
    public void enter_uses_an_already_open_channel() {
        complete(channel.initialize());

        try (ChannelScope scope = ChannelScope.open(channel)) {
            assertThat(scope.channel().getState(), is(ChannelState.READY));
        }

        assertThat(connection.getOpenedChannels(), is(1));
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
    }

    @Test
    public void recorded_failure_is_the_close_reason() {
        IllegalStateException failure = new IllegalStateException("failed inside scope");

        try (ChannelScope scope = ChannelScope.open(channel)) {
            scope.fail(failure);
        }

        assertThat(closeReasons.size(), is(1));
        assertThat(closeReasons.get(0).getCause(), sameInstance((Throwable) failure));
    }

    @Test
    public void using_closes_with_the_thrown_exception() {
        IllegalStateException failure = new IllegalStateException("failed in function");
        try {
            ChannelScope.using(channel, ch -> {
                throw failure;
            });
            fail("Expected an exception");
        } catch (IllegalStateException e) {
            assertThat(e, sameInstance(failure));
        }

        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
        assertThat(closeReasons.get(0).getCause(), sameInstance((Throwable) failure));
    }

    @Test
    public void using_returns_the_function_result() {
        String name = ChannelScope.using(channel, ch -> valueOf(ch.declareQueue("")).getName());

        assertTrue(name.startsWith("amq.gen-"));
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
    }

    @Test
    public void single_closes_after_success() {
        Queue queue = valueOf(ChannelScope.single(channel, ch -> ch.declareQueue("reactive")));

        assertThat(queue.getName(), is("reactive"));
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
        assertThat(closeReasons.size(), is(1));
    }

    @Test
    public void single_closes_with_the_error() {
        IllegalArgumentException failure = new IllegalArgumentException("bad");

        Throwable error = errorOf(ChannelScope.single(channel, ch -> Single.error(failure)));

        assertThat(error, sameInstance((Throwable) failure));
        assertThat(channel.getState(), is(ChannelState.CLOSED_BY_USER));
        assertThat(closeReasons.get(0).getCause(), sameInstance((Throwable) failure));
    }

    @Test
    public void single_closes_when_unsubscribed() {
        Subscription subscription = ChannelScope.single(channel, ch -> Observable.<String>never().toSingle()).subscribe();
        await().atMost(5, TimeUnit.SECONDS).until(() -> channel.getState() == ChannelState.READY);

        subscription.unsubscribe();

        await().atMost(5, TimeUnit.SECONDS).until(() -> channel.getState() == ChannelState.CLOSED_BY_USER);
        assertThat(closeReasons.get(0).getCause(), instanceOf(CancellationException.class));
    }

    @Test
    public void scope_is_left_closed_only_once() {
        ChannelScope scope = ChannelScope.open(channel);

        scope.close();
        scope.close();

        assertThat(closeReasons.size(), is(1));
    }
}
