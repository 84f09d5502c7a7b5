package com.txarchive.ingestion.adapter;

import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * PubSub transport over the Reactor Netty WebSocket client.
 */
public class ReactorNettySolanaStreamClient implements SolanaStreamClient {

    private final WebSocketClient client;

    public ReactorNettySolanaStreamClient() {
        this(new ReactorNettyWebSocketClient());
    }

    public ReactorNettySolanaStreamClient(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public Flux<String> stream(String endpointUrl, String subscribeRequest) {
        return Flux.<String>create(sink -> {
            Disposable session = client.execute(URI.create(endpointUrl), ws ->
                            ws.send(Mono.just(ws.textMessage(subscribeRequest)))
                                    .thenMany(ws.receive()
                                            .map(WebSocketMessage::getPayloadAsText)
                                            .doOnNext(sink::next))
                                    .then())
                    .subscribe(ignored -> { }, sink::error, sink::complete);
            sink.onDispose(session);
        }).onErrorMap(e -> !(e instanceof RpcException), e -> classify(endpointUrl, e));
    }

    private static RpcException classify(String endpointUrl, Throwable e) {
        if (e instanceof WebSocketClientHandshakeException handshake && handshake.response() != null) {
            int status = handshake.response().status().code();
            if (status == 401 || status == 403) {
                return new SubscriptionRejectedException("Handshake refused by " + endpointUrl + ": HTTP " + status, e);
            }
        }
        return new RpcException("Stream from " + endpointUrl + " failed: " + e.getMessage(), e);
    }
}
