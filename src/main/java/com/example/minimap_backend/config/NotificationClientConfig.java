package com.example.minimap_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(NotificationClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    @Bean("webhookWebClient")
    public WebClient webhookWebClient(NotificationProperties props) {
        Duration timeout = props.getTimeout() != null ? props.getTimeout() : Duration.ofSeconds(60);
        long timeoutSec = Math.max(1, timeout.toSeconds());

        HttpClient httpClient = HttpClient.create()
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSec, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSec, TimeUnit.SECONDS))
                );

        LOGGER.info("Configuring webhook WebClient connect={}ms response={}s", CONNECT_TIMEOUT_MILLIS, timeoutSec);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
