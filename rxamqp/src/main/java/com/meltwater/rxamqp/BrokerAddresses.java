package com.meltwater.rxamqp;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.rabbitmq.client.ConnectionFactory;

import java.net.URI;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered list of AMQP URIs. A {@link com.meltwater.rxamqp.impl.RabbitConnection} tries them in order.
 *
 * Every URI is checked with the amqp client when the list is created, so {@link #configure(URI, ConnectionFactory)}
 * does not fail later. Both amqp and amqps URIs are accepted.
 *
 * @see <a href="https://www.rabbitmq.com/uri-spec.html">AMQP URI spec</a>
 */
public class BrokerAddresses implements Iterable<URI> {

    private final ImmutableList<URI> uris;

    /**
     * @param addressesString comma separated AMQP URIs
     * @throws IllegalArgumentException if the string is empty or one of the URIs is invalid
     */
    public BrokerAddresses(String addressesString) {
        this(parse(addressesString));
    }

    public BrokerAddresses(List<URI> uris) {
        if (uris.isEmpty()) {
            throw new IllegalArgumentException("At least one broker address is required");
        }
        for (URI uri : uris) {
            configure(uri, new ConnectionFactory());
        }
        this.uris = ImmutableList.copyOf(uris);
    }

    private static List<URI> parse(String addressesString) {
        if (addressesString == null) {
            throw new IllegalArgumentException("At least one broker address is required");
        }
        ImmutableList.Builder<URI> out = ImmutableList.builder();
        for (String uri : Splitter.on(',').trimResults().omitEmptyStrings().split(addressesString)) {
            try {
                out.add(URI.create(uri));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid broker address '" + redactedString(uri) + "'", e);
            }
        }
        return out.build();
    }

    /**
     * Sets the host, port, credentials and virtual host of the given address on the factory.
     *
     * @throws IllegalArgumentException if the address is not a valid AMQP URI
     */
    public static ConnectionFactory configure(URI uri, ConnectionFactory factory) {
        try {
            factory.setUri(uri);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid broker address '" + redacted(uri) + "'", e);
        }
        return factory;
    }

    /**
     * @return the address without user name and password, safe to log
     */
    public static String redacted(URI uri) {
        String scheme = uri.getScheme() == null ? "amqp" : uri.getScheme().toLowerCase();
        int port = uri.getPort() != -1
                ? uri.getPort()
                : "amqps".equals(scheme) ? ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT : ConnectionFactory.DEFAULT_AMQP_PORT;
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return scheme + "://" + uri.getHost() + ":" + port + path;
    }

    private static String redactedString(String uri) {
        int at = uri.lastIndexOf('@');
        int schemeEnd = uri.indexOf("://");
        return at > schemeEnd && schemeEnd >= 0 ? uri.substring(0, schemeEnd + 3) + uri.substring(at + 1) : uri;
    }

    public List<URI> getUris() {
        return uris;
    }

    public URI get(int i) {
        return uris.get(i);
    }

    public int size() {
        return uris.size();
    }

    @Override
    public Iterator<URI> iterator() {
        return uris.iterator();
    }

    @Override
    public String toString() {
        return "[" + Joiner.on(", ").join(Lists.transform(uris, BrokerAddresses::redacted)) + "]";
    }
}
