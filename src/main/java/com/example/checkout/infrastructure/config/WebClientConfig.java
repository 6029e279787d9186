package com.example.checkout.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for the payment provider and the cart service.
 */
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 2000;

    @Value("${services.payment-provider.base-url:http://localhost:8082}")
    private String paymentProviderBaseUrl;

    @Value("${services.payment-provider.key-id:}")
    private String paymentProviderKeyId;

    @Value("${services.payment-provider.key-secret:}")
    private String paymentProviderKeySecret;

    @Value("${services.payment-provider.timeout-ms:8000}")
    private int paymentProviderTimeoutMs;

    @Value("${services.cart.base-url:http://localhost:8081}")
    private String cartBaseUrl;

    @Value("${services.cart.timeout-ms:3000}")
    private int cartTimeoutMs;

    @Bean
    public WebClient paymentProviderWebClient(WebClient.Builder builder) {
        return createWebClient(builder.clone(), paymentProviderBaseUrl, paymentProviderTimeoutMs)
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setBasicAuth(paymentProviderKeyId, paymentProviderKeySecret);
                })
                .build();
    }

    @Bean
    public WebClient cartWebClient(WebClient.Builder builder) {
        return createWebClient(builder.clone(), cartBaseUrl, cartTimeoutMs)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private WebClient.Builder createWebClient(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofMillis(timeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return builder
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
