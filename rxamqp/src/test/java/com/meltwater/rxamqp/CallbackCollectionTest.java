package com.meltwater.rxamqp;

import org.junit.Before;
import org.junit.Test;
import rx.functions.Action2;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class CallbackCollectionTest {

    private final Object owner = "owner";
    private CallbackCollection<Object, String> callbacks;
    private List<String> calls;

    @Before
    public void setup() {
        callbacks = new CallbackCollection<>(owner);
        calls = new ArrayList<>();
    }

    @Test
    public void fires_handlers_in_registration_order_with_owner_and_argument() {
        callbacks.add((o, arg) -> calls.add("first:" + o + ":" + arg));
        callbacks.add((o, arg) -> calls.add("second:" + o + ":" + arg));

        List<Throwable> failures = callbacks.fire("event");

        assertThat(failures, is(empty()));
        assertThat(calls, contains("first:owner:event", "second:owner:event"));
    }

    @Test
    public void adding_the_same_handler_twice_registers_it_once() {
        Action2<Object, String> handler = (o, arg) -> calls.add(arg);

        assertTrue(callbacks.add(handler));
        assertFalse(callbacks.add(handler));
        callbacks.fire("once");

        assertThat(callbacks.size(), is(1));
        assertThat(calls, contains("once"));
    }

    @Test
    public void discarded_handler_is_not_called() {
        Action2<Object, String> handler = (o, arg) -> calls.add(arg);
        callbacks.add(handler);

        assertTrue(callbacks.discard(handler));
        assertFalse(callbacks.discard(handler));
        callbacks.fire("ignored");

        assertThat(calls, is(empty()));
        assertTrue(callbacks.isEmpty());
        assertFalse(callbacks.contains(handler));
    }

    @Test
    public void failing_handler_is_reported_and_the_rest_still_run() {
        IllegalStateException boom = new IllegalStateException("boom");
        callbacks.add((o, arg) -> calls.add("before"));
        callbacks.add((o, arg) -> {
            throw boom;
        });
        callbacks.add((o, arg) -> calls.add("after"));

        List<Throwable> failures = callbacks.fire("event");

        assertThat(calls, contains("before", "after"));
        assertThat(failures.size(), is(1));
        assertThat(failures.get(0), sameInstance((Throwable) boom));
    }

    @Test
    public void null_argument_is_passed_through() {
        callbacks.add((o, arg) -> calls.add(String.valueOf(arg)));

        callbacks.fire(null);

        assertThat(calls, contains("null"));
    }

    @Test
    public void handler_may_discard_itself_while_firing() {
        List<Action2<Object, String>> self = new ArrayList<>();
        Action2<Object, String> handler = (o, arg) -> {
            calls.add(arg);
            callbacks.discard(self.get(0));
        };
        self.add(handler);
        callbacks.add(handler);

        callbacks.fire("first");
        callbacks.fire("second");

        assertThat(calls, contains("first"));
    }

    @Test
    public void handlers_that_are_equal_are_registered_and_discarded_separately() {
        EqualHandler first = new EqualHandler("first");
        EqualHandler second = new EqualHandler("second");

        assertTrue(callbacks.add(first));
        assertTrue(callbacks.add(second));
        assertThat(callbacks.size(), is(2));

        callbacks.fire("event");
        assertThat(calls, contains("first", "second"));

        assertTrue(callbacks.discard(second));
        assertTrue(callbacks.contains(first));
        assertFalse(callbacks.contains(second));
        callbacks.fire("event");
        assertThat(calls, contains("first", "second", "first"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void null_handler_is_rejected() {
        callbacks.add(null);
    }

    @Test
    public void clear_removes_all_handlers() {
        callbacks.add((o, arg) -> calls.add(arg));
        callbacks.add((o, arg) -> calls.add(arg));

        callbacks.clear();
        callbacks.fire("nothing");

        assertThat(calls, is(empty()));
        assertThat(callbacks.getOwner(), sameInstance(owner));
    }

    private class EqualHandler implements Action2<Object, String> {

        private final String name;

        EqualHandler(String name) {
            this.name = name;
        }

        @Override
        public void call(Object o, String arg) {
            calls.add(name);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof EqualHandler;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }
}
