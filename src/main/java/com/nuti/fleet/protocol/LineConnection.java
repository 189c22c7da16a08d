package com.nuti.fleet.protocol;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Newline-framed text over one socket. Not thread-safe; owned by a single car.
 */
public final class LineConnection implements Closeable {

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;

    public LineConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public void send(String line) throws IOException {
        writer.write(line);
        if (!line.endsWith("\n")) {
            writer.write('\n');
        }
        writer.flush();
    }

    public String readLine() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new EOFException("Server closed connection");
        }
        return line;
    }

    public String exchange(String line) throws IOException {
        send(line);
        return readLine();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
