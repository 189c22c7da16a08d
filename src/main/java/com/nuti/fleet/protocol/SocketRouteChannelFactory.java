package com.nuti.fleet.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Objects;

/**
 * Opens one TCP connection per car. The timeout bounds both connect and every read.
 */
public final class SocketRouteChannelFactory implements RouteChannelFactory {

    private final String host;
    private final int port;
    private final int timeoutMs;
    private final WireProtocol protocol;
    private final ObjectMapper mapper = new ObjectMapper();

    public SocketRouteChannelFactory(String host, int port, int timeoutMs, WireProtocol protocol) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in [1,65535]");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.timeoutMs = timeoutMs;
        this.protocol = Objects.requireNonNull(protocol, "protocol");
    }

    @Override
    public RouteChannel open(int carId) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            socket.setTcpNoDelay(true);
            LineConnection connection = new LineConnection(socket);
            return switch (protocol) {
                case TEXT -> new TextRouteChannel(connection);
                case JSON -> new JsonRouteChannel(connection, mapper);
            };
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }
}
