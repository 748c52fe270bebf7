package com.cmdchat.client.config;

import com.cmdchat.client.connection.ChannelConnector;
import com.cmdchat.client.connection.ReactorChannelConnector;
import com.cmdchat.client.connection.ReconnectPolicy;
import com.cmdchat.client.handshake.KeyExchangeClient;
import com.cmdchat.client.render.ChatRenderer;
import com.cmdchat.client.render.ConsoleRenderer;
import com.cmdchat.protocol.FrameCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }

    @Bean
    public ChatRenderer chatRenderer() {
        return new ConsoleRenderer(System.out, ZoneId.systemDefault());
    }

    @Bean
    public ReconnectPolicy reconnectPolicy(ClientProperties properties) {
        return new ReconnectPolicy(properties.maxRetries(), properties.baseDelay());
    }

    @Bean
    public KeyExchangeClient keyExchangeClient(WebClient.Builder builder, ClientProperties properties) {
        return new KeyExchangeClient(builder.baseUrl(properties.httpBaseUrl()).build(),
                properties.messageMaxAge(), properties.connectTimeout());
    }

    @Bean
    public ChannelConnector channelConnector(ClientProperties properties) {
        return new ReactorChannelConnector(new ReactorNettyWebSocketClient(), properties);
    }
}
