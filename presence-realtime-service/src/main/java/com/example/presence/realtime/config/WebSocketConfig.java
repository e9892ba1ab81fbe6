package com.example.presence.realtime.config;

import com.example.presence.realtime.websocket.RealtimeWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    public static final String REALTIME_PATH = "/ws/realtime";

    @Bean
    public HandlerMapping realtimeHandlerMapping(RealtimeWebSocketHandler realtimeWebSocketHandler) {
        // Ahead of annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(REALTIME_PATH, realtimeWebSocketHandler), -1);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
