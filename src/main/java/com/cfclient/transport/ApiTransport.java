package com.cfclient.transport;

import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * HTTP GET abstraction used by the request pipeline, so tests can swap the network out.
 */
public interface ApiTransport extends AutoCloseable {

    /**
     * Perform one GET against a fully formed URL. The request is sent on subscription and abandoned on cancel.
     *
     * @param uri complete request URI; it is sent as-is, without re-encoding
     * @return raw response body; errors with CodeforcesTransportException on network failure or rejected status
     */
    Mono<byte[]> get(URI uri);

    /**
     * Release pooled connections. Safe to call more than once.
     */
    @Override
    void close();
}
