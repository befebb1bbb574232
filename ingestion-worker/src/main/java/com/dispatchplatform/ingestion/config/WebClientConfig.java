package com.dispatchplatform.ingestion.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Long-lived audio streams. No response or read timeout: silence is detected by the
     * connector's liveness check, not by the transport.
     */
    @Bean
    public WebClient streamWebClient(WebClient.Builder builder, IngestionProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);

        return builder.clone()
            .baseUrl(properties.getStreams().getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    /** Request/response APIs (call logs, audio downloads, cameras) with bounded timeouts. */
    @Bean
    public WebClient apiWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(20))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(20, TimeUnit.SECONDS))
            );

        return builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient speechWebClient(WebClient.Builder builder, IngestionProperties properties) {
        Duration timeout = properties.getSpeech().getTimeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(timeout);

        return builder.clone()
            .baseUrl(properties.getSpeech().getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.error(new IllegalStateException("Upstream server error: " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String uri = clientRequest.url().toString();
            String sanitized = uri.replaceAll("(?i)(token|key)=[^&]+", "$1=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
