package com.cfclient.client;

import com.cfclient.auth.RequestSigner;
import com.cfclient.auth.SigningContext;
import com.cfclient.decode.ResponseDecoder;
import com.cfclient.endpoint.EndpointBuilder;
import com.cfclient.transport.ApiTransport;
import com.cfclient.transport.TransportSettings;
import com.cfclient.transport.WebClientApiTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.function.IntSupplier;

/**
 * Assembles the request pipeline behind both client variants. Everything has a default:
 * public API root, unsigned requests, pooled WebClient transport, plain ObjectMapper.
 */
public final class CodeforcesClientBuilder {

    private String apiRoot = EndpointBuilder.DEFAULT_API_ROOT;
    private SigningContext signing = SigningContext.disabled();
    private TransportSettings transportSettings = TransportSettings.defaults();
    private WebClient.Builder webClientBuilder;
    private ApiTransport transport;
    private ObjectMapper objectMapper;
    private Clock clock = Clock.systemUTC();
    private IntSupplier nonceSource = RequestSigner.randomNonce();

    CodeforcesClientBuilder() {
    }

    public CodeforcesClientBuilder apiRoot(String apiRoot) {
        this.apiRoot = apiRoot;
        return this;
    }

    public CodeforcesClientBuilder signing(SigningContext signing) {
        this.signing = signing;
        return this;
    }

    public CodeforcesClientBuilder transportSettings(TransportSettings transportSettings) {
        this.transportSettings = transportSettings;
        return this;
    }

    /**
     * Base builder for the pooled transport. Ignored when {@link #transport(ApiTransport)} is set.
     */
    public CodeforcesClientBuilder webClientBuilder(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
        return this;
    }

    /**
     * Use this transport as-is. The client takes ownership and closes it.
     */
    public CodeforcesClientBuilder transport(ApiTransport transport) {
        this.transport = transport;
        return this;
    }

    public CodeforcesClientBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public CodeforcesClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /** Source of the 6-digit signature nonce. */
    public CodeforcesClientBuilder nonceSource(IntSupplier nonceSource) {
        this.nonceSource = nonceSource;
        return this;
    }

    public ReactiveCodeforcesClient buildReactive() {
        return new ReactiveCodeforcesClient(buildPipeline());
    }

    public CodeforcesClient build() {
        return new CodeforcesClient(buildReactive());
    }

    CodeforcesRequestPipeline buildPipeline() {
        EndpointBuilder endpoints = new EndpointBuilder(apiRoot);
        RequestSigner signer = new RequestSigner(endpoints.apiRoot(), signing, clock, nonceSource);
        ApiTransport resolvedTransport = transport != null
                ? transport
                : WebClientApiTransport.pooled(webClientBuilder != null ? webClientBuilder : WebClient.builder(),
                        transportSettings);
        ResponseDecoder decoder = objectMapper != null ? new ResponseDecoder(objectMapper) : new ResponseDecoder();
        return new CodeforcesRequestPipeline(endpoints, signer, resolvedTransport, decoder);
    }
}
