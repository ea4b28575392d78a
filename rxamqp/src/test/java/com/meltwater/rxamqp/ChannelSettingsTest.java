package com.meltwater.rxamqp;

import org.junit.Test;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ChannelSettingsTest {

    @Test
    public void defaults_use_publisher_confirms_without_raising_on_returns() {
        ChannelSettings settings = ChannelSettings.defaults();

        assertThat(settings.channel_number, nullValue());
        assertThat(settings.publisher_confirms, is(true));
        assertThat(settings.on_return_raises, is(false));
        assertThat(settings.operation_timeout_millis, is(0));
    }

    @Test
    public void builder_sets_all_fields() {
        ChannelSettings settings = new ChannelSettings.Builder()
                .withChannelNumber(3)
                .withPublisherConfirms(true)
                .withOnReturnRaises(true)
                .withOperationTimeoutMillis(2_000)
                .build();

        assertThat(settings.channel_number, is(3));
        assertThat(settings.on_return_raises, is(true));
        assertThat(settings.operation_timeout_millis, is(2_000));
    }

    @Test
    public void parses_relaxed_json() {
        ChannelSettings settings = new ChannelSettings.Builder("channel_number:5, publisher_confirms:false, operation_timeout_millis:100").build();

        assertThat(settings.channel_number, is(5));
        assertThat(settings.publisher_confirms, is(false));
        assertThat(settings.on_return_raises, is(false));
        assertThat(settings.operation_timeout_millis, is(100));
    }

    @Test
    public void to_string_can_be_parsed_back() {
        ChannelSettings settings = new ChannelSettings.Builder()
                .withChannelNumber(9)
                .withOnReturnRaises(true)
                .build();

        assertThat(new ChannelSettings.Builder(settings.toString()).build(), is(settings));
    }

    @Test
    public void unknown_setting_is_rejected() {
        try {
            new ChannelSettings.Builder("{\"publisher_confirm\": true}");
            fail("Expected an exception");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("publisher_confirm"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicate_setting_is_rejected() {
        new ChannelSettings.Builder("publisher_confirms:true, publisher_confirms:false");
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformed_json_is_rejected() {
        new ChannelSettings.Builder("{channel_number: }");
    }
}
