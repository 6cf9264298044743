package com.cfclient.config;

import com.cfclient.auth.SigningContext;
import com.cfclient.client.CodeforcesClient;
import com.cfclient.client.CodeforcesClientBuilder;
import com.cfclient.endpoint.EndpointBuilder;
import com.cfclient.transport.TransportSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Codeforces client configuration, bound from {@code cfclient.*}.
 */
@ConfigurationProperties(prefix = "cfclient")
@Validated
@Getter
@Setter
public class CodeforcesClientProperties {

    /**
     * API root without the method name.
     */
    @NotBlank
    private String baseUrl = EndpointBuilder.DEFAULT_API_ROOT;

    @Valid
    private Auth auth = new Auth();

    /**
     * TCP connect timeout. Unset means the reactor-netty default.
     */
    private Duration connectTimeout;

    /**
     * Time to wait for the full response. Unset means no limit.
     */
    private Duration responseTimeout;

    @Min(1)
    private int maxConnections = 50;

    private Duration maxIdleTime = Duration.ofSeconds(30);

    private String userAgent;

    /**
     * Builder preloaded with these settings, for use outside a Spring context.
     */
    public CodeforcesClientBuilder toBuilder() {
        TransportSettings defaults = TransportSettings.defaults();
        return CodeforcesClient.builder()
                .apiRoot(baseUrl)
                .signing(auth.toSigningContext())
                .transportSettings(new TransportSettings(
                        maxConnections,
                        maxIdleTime != null ? maxIdleTime : defaults.maxIdleTime(),
                        connectTimeout,
                        responseTimeout,
                        defaults.maxResponseBytes(),
                        userAgent));
    }

    @Getter
    @Setter
    public static class Auth {
        /** Sign requests with key and secret. Required for user.friends and manager-only data. */
        private boolean enabled = false;
        private String key;
        /** Never logged. */
        private String secret;
        /** Unix seconds to sign with instead of the clock; for reproducible signatures. */
        private Long fixedTime;

        SigningContext toSigningContext() {
            if (!enabled) {
                return SigningContext.disabled();
            }
            return SigningContext.of(key, secret).withFixedTime(fixedTime);
        }

        @Override
        public String toString() {
            return "Auth[enabled=" + enabled + ", key=" + key + ", secret=***, fixedTime=" + fixedTime + "]";
        }
    }
}
