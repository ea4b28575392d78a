package com.meltwater.rxamqp;

import com.meltwater.rxamqp.util.Logger;
import rx.functions.Action2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An ordered set of event handlers that belongs to one owner object.
 *
 * Every handler is called with the owner and the event argument. A handler that throws is logged and does not stop
 * the remaining handlers from being called. The failures are handed back to the caller of {@link #fire(Object)}
 * instead of being thrown.
 *
 * Handlers are told apart by identity, equals is not used.
 *
 * Handlers can be added and removed from any thread, also while the collection is being fired. A fire call
 * iterates over the handlers that were registered when it started.
 *
 * @param <O> the owner type
 * @param <T> the event argument type
 */
public class CallbackCollection<O, T> {

    private static final Logger log = new Logger(CallbackCollection.class);

    private final O owner;
    private final CopyOnWriteArrayList<Action2<? super O, ? super T>> handlers = new CopyOnWriteArrayList<>();

    public CallbackCollection(O owner) {
        assert owner != null;
        this.owner = owner;
    }

    public O getOwner() {
        return owner;
    }

    /**
     * Adds the handler. Adding an already registered handler is a no-op.
     *
     * @return true if the handler was not already registered
     */
    public synchronized boolean add(Action2<? super O, ? super T> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (indexOf(handler) >= 0) {
            return false;
        }
        return handlers.add(handler);
    }

    /**
     * Removes the handler. Removing an unknown handler is a no-op.
     *
     * @return true if the handler was registered
     */
    public synchronized boolean discard(Action2<? super O, ? super T> handler) {
        int index = indexOf(handler);
        if (index < 0) {
            return false;
        }
        handlers.remove(index);
        return true;
    }

    public boolean contains(Action2<? super O, ? super T> handler) {
        return indexOf(handler) >= 0;
    }

    private int indexOf(Action2<? super O, ? super T> handler) {
        Object[] snapshot = handlers.toArray();
        for (int i = 0; i < snapshot.length; i++) {
            if (snapshot[i] == handler) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return handlers.size();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public synchronized void clear() {
        handlers.clear();
    }

    /**
     * Calls all the handlers with the given argument.
     *
     * @param argument passed to every handler, may be null
     * @return the errors thrown by the handlers, empty if all of them succeeded
     */
    public List<Throwable> fire(T argument) {
        List<Throwable> failures = null;
        for (Action2<? super O, ? super T> handler : handlers) {
            try {
                handler.call(owner, argument);
            } catch (Throwable e) {
                log.warnWithParams("Callback failed.", e,
                        "owner", owner,
                        "handler", handler);
                if (failures == null) {
                    failures = new ArrayList<>();
                }
                failures.add(e);
            }
        }
        return failures == null ? Collections.emptyList() : failures;
    }

    @Override
    public String toString() {
        return "CallbackCollection{" +
                "owner=" + owner +
                ", handlers=" + handlers.size() +
                '}';
    }
}
