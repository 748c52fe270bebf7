package com.cmdchat.config;

import com.cmdchat.channel.TalkChannelHandler;
import com.cmdchat.channel.UpdateChannelHandler;
import com.cmdchat.protocol.ChannelPath;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping chatChannelMapping(TalkChannelHandler talk, UpdateChannelHandler update) {
        Map<String, WebSocketHandler> channels = Map.of(
                ChannelPath.TALK.path(), talk,
                ChannelPath.UPDATE.path(), update);
        return new SimpleUrlHandlerMapping(channels, -1);
    }
}
