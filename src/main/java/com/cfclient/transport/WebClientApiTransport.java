package com.cfclient.transport;

import com.cfclient.common.CodeforcesException;
import com.cfclient.common.CodeforcesTransportException;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ApiTransport} on Spring WebClient.
 * <p>
 * The API reports FAILED envelopes with HTTP 400, so 2xx bodies and JSON 4xx bodies are handed to the decoder.
 * 5xx, and any other non-2xx (no body, or not JSON such as a proxy error page), fail here with
 * {@link CodeforcesTransportException}.
 */
@Slf4j
public class WebClientApiTransport implements ApiTransport {

    private static final byte[] EMPTY = new byte[0];

    private final WebClient webClient;
    /** Null when the WebClient was supplied from outside and its resources are not ours to release. */
    private final ConnectionProvider connectionProvider;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebClientApiTransport(WebClient.Builder builder) {
        this(builder.build(), null);
    }

    private WebClientApiTransport(WebClient webClient, ConnectionProvider connectionProvider) {
        this.webClient = webClient;
        this.connectionProvider = connectionProvider;
    }

    /**
     * Transport with its own reactor-netty connection pool, released by {@link #close()}.
     */
    public static WebClientApiTransport pooled(WebClient.Builder builder, TransportSettings settings) {
        ConnectionProvider provider = ConnectionProvider.builder("codeforces-client")
                .maxConnections(settings.maxConnections())
                .maxIdleTime(settings.maxIdleTime())
                .build();
        HttpClient httpClient = HttpClient.create(provider);
        if (settings.connectTimeout() != null) {
            httpClient = httpClient.option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                    (int) settings.connectTimeout().toMillis());
        }
        if (settings.responseTimeout() != null) {
            httpClient = httpClient.responseTimeout(settings.responseTimeout());
        }
        WebClient.Builder configured = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(settings.maxResponseBytes()));
        if (settings.userAgent() != null) {
            configured.defaultHeader(HttpHeaders.USER_AGENT, settings.userAgent());
        }
        return new WebClientApiTransport(configured.build(), provider);
    }

    @Override
    public Mono<byte[]> get(URI uri) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> readBody(uri, response))
                .onErrorMap(e -> !(e instanceof CodeforcesException),
                        e -> new CodeforcesTransportException("GET " + uri.getPath() + " failed: " + e.getMessage(), e))
                .doOnError(CodeforcesTransportException.class,
                        e -> log.warn("Codeforces transport error on {}: {}", uri.getPath(), e.getMessage()));
    }

    private Mono<byte[]> readBody(URI uri, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is5xxServerError() || (!status.is2xxSuccessful() && !isJson(response))) {
            return response.releaseBody()
                    .then(Mono.<byte[]>error(rejected(uri, status)));
        }
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(EMPTY)
                .flatMap(body -> {
                    if (!status.is2xxSuccessful() && body.length == 0) {
                        return Mono.<byte[]>error(rejected(uri, status));
                    }
                    return Mono.just(body);
                });
    }

    private static boolean isJson(ClientResponse response) {
        return response.headers().contentType()
                .map(type -> type.isCompatibleWith(MediaType.APPLICATION_JSON))
                .orElse(false);
    }

    private static CodeforcesTransportException rejected(URI uri, HttpStatusCode status) {
        return new CodeforcesTransportException(
                "GET " + uri.getPath() + " returned HTTP " + status.value(), status.value());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && connectionProvider != null) {
            connectionProvider.dispose();
            log.debug("Codeforces connection pool disposed");
        }
    }
}
