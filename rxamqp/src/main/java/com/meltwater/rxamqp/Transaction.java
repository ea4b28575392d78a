package com.meltwater.rxamqp;

import com.meltwater.rxamqp.util.Logger;
import rx.Completable;

/**
 * An AMQP transaction on a {@link Channel}. Only available on channels without publisher confirms.
 *
 * @see Channel#transaction()
 */
public class Transaction {

    private static final Logger log = new Logger(Transaction.class);

    public enum State {
        CREATED,
        STARTED,
        COMMITED,
        ROLLED_BACK
    }

    private final Channel channel;
    private volatile State state = State.CREATED;

    Transaction(Channel channel) {
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }

    public State getState() {
        return state;
    }

    /**
     * Puts the channel in transactional mode.
     */
    public Completable select(long timeoutMillis) {
        return channel.execute(ch -> {
            ch.txSelect();
            state = State.STARTED;
            log.debugWithParams("Transaction started.", "channel", channel);
            return null;
        }, timeoutMillis).toCompletable();
    }

    public Completable commit(long timeoutMillis) {
        return channel.execute(ch -> {
            checkStarted("commit");
            ch.txCommit();
            state = State.COMMITED;
            return null;
        }, timeoutMillis).toCompletable();
    }

    public Completable rollback(long timeoutMillis) {
        return channel.execute(ch -> {
            checkStarted("rollback");
            ch.txRollback();
            state = State.ROLLED_BACK;
            return null;
        }, timeoutMillis).toCompletable();
    }

    private void checkStarted(String operation) {
        if (state == State.CREATED) {
            throw new IllegalStateException("Can't " + operation + " a transaction that was not selected");
        }
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "channel=" + channel +
                ", state=" + state +
                '}';
    }
}
