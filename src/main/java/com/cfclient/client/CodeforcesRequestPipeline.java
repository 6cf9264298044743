package com.cfclient.client;

import com.cfclient.auth.RequestSigner;
import com.cfclient.common.CodeforcesApiException;
import com.cfclient.decode.ResponseDecoder;
import com.cfclient.endpoint.Endpoint;
import com.cfclient.endpoint.EndpointBuilder;
import com.cfclient.transport.ApiTransport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * endpoint → sign → GET → decode, shared by the blocking and reactive clients.
 * Holds no per-call state; safe for concurrent use.
 */
@Slf4j
public class CodeforcesRequestPipeline implements AutoCloseable {

    private final EndpointBuilder endpoints;
    private final RequestSigner signer;
    private final ApiTransport transport;
    private final ResponseDecoder decoder;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CodeforcesRequestPipeline(EndpointBuilder endpoints, RequestSigner signer,
                                     ApiTransport transport, ResponseDecoder decoder) {
        this.endpoints = endpoints;
        this.signer = signer;
        this.transport = transport;
        this.decoder = decoder;
    }

    public EndpointBuilder endpoints() {
        return endpoints;
    }

    /**
     * Signs and sends on subscription, so a re-subscribed Mono gets a fresh nonce and timestamp.
     * Fails with IllegalStateException once the pipeline is closed.
     */
    public <T> Mono<List<T>> execute(Endpoint endpoint, Class<T> elementType) {
        return Mono.defer(() -> {
            if (closed.get()) {
                return Mono.error(new IllegalStateException("Codeforces client is closed"));
            }
            String url = signer.sign(endpoints.url(endpoint), endpoint.method());
            log.debug("Codeforces GET {}", RequestSigner.redact(url));
            return transport.get(URI.create(url))
                    .map(body -> decoder.decode(body, elementType))
                    .doOnError(CodeforcesApiException.class,
                            e -> log.warn("Codeforces {} rejected: {}", endpoint.method(), e.getMessage()));
        });
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transport.close();
            log.info("Codeforces client closed");
        }
    }
}
