package com.meltwater.rxamqp.util;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class LoggerTest {

    private final Logger log = new Logger(LoggerTest.class);

    @Test
    public void message_without_arguments_is_unchanged() {
        assertThat(log.buildLogMessage("Channel opened.", new Object[0]), is("Channel opened."));
    }

    @Test
    public void primitives_are_unquoted_and_objects_quoted() {
        String message = log.buildLogMessage("Channel closed.", new Object[]{"channelNr", 3, "reason", "peer", "cause", null});

        assertThat(message, is("Channel closed. [ channelNr=3, reason=\"peer\", cause=null ]"));
    }

    @Test
    public void list_values_repeat_the_key() {
        String message = log.buildLogMessage("Broker addresses.", new Object[]{"host", Arrays.asList("a", "b")});

        assertThat(message, is("Broker addresses. [ host=\"a\", host=\"b\" ]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void odd_number_of_arguments_is_rejected() {
        log.buildLogMessage("Broken.", new Object[]{"key"});
    }

    @Test
    public void unpaired_arguments_do_not_fail_the_caller() {
        log.infoWithParams("Unpaired.", "key");
    }
}
