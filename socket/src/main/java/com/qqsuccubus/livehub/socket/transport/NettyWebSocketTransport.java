package com.qqsuccubus.livehub.socket.transport;

import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.Connection;
import reactor.netty.http.websocket.WebsocketOutbound;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over a Reactor Netty WebSocket.
 * <p>
 * Writes never block: frames are emitted into a bounded per-connection sink that the
 * outbound side drains. A full sink is reported as a {@link TransportException}.
 * </p>
 */
public class NettyWebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    private final Connection connection;
    private final WebsocketOutbound outbound;
    private final Sinks.Many<WebSocketFrame> sink;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettyWebSocketTransport(Connection connection, WebsocketOutbound outbound, int bufferSize) {
        this.connection = connection;
        this.outbound = outbound;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(
                Queues.<WebSocketFrame>get(bufferSize).get()
        );
    }

    /**
     * Frames to be written by the outbound side of the socket.
     */
    public Flux<WebSocketFrame> outboundFrames() {
        return sink.asFlux();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !connection.isDisposed() && connection.channel().isActive();
    }

    @Override
    public void send(String text) {
        emit(new TextWebSocketFrame(text));
    }

    @Override
    public void ping() {
        emit(new PingWebSocketFrame());
    }

    private void emit(WebSocketFrame frame) {
        if (!isOpen()) {
            frame.release();
            throw new TransportException("Socket closed");
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            frame.release();
            throw new TransportException("Failed to emit frame: " + result);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        outbound.sendClose()
                .onErrorResume(err -> {
                    log.debug("Close frame not sent: {}", err.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> connection.dispose())
                .subscribe();
    }
}
