package herald.server.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import herald.sse.EventFormatter;

/**
 * Minimal HTTP/1.1 client that reads a chunked event stream one chunk at a time.
 */
public class SseTestClient implements AutoCloseable {

    private final Socket socket;
    private final InputStream in;
    private int status;
    private final Map<String,String> headers = new HashMap<>();

    public SseTestClient(int port) throws IOException {
        this.socket = new Socket("127.0.0.1", port);
        this.socket.setSoTimeout(10000);
        this.in = socket.getInputStream();
    }

    public SseTestClient request(String method, String uri) throws IOException {
        OutputStream out = socket.getOutputStream();
        String request = method + " " + uri + " HTTP/1.1\r\nHost: localhost\r\nAccept: text/event-stream\r\n\r\n";
        out.write(request.getBytes(StandardCharsets.US_ASCII));
        out.flush();
        String statusLine = readLine();
        status = Integer.parseInt(statusLine.split(" ")[1]);
        String line;
        while (!(line = readLine()).isEmpty()) {
            int colon = line.indexOf(':');
            headers.put(line.substring(0, colon).trim().toLowerCase(), line.substring(colon + 1).trim());
        }
        return this;
    }

    public int getStatus() {
        return status;
    }

    public String getHeader(String name) {
        return headers.get(name.toLowerCase());
    }

    /**
     * @return the next chunk as text, or null when the stream ended
     */
    public String readChunk() throws IOException {
        String sizeLine = readLine();
        if (sizeLine == null) {
            return null;
        }
        int size = Integer.parseInt(sizeLine.trim(), 16);
        byte[] data = in.readNBytes(size);
        readLine();
        if (size == 0) {
            return null;
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Same as {@link #readChunk()} but skips keep-alive comments.
     */
    public String readEvent() throws IOException {
        String chunk;
        String ping = new String(EventFormatter.PING, StandardCharsets.UTF_8);
        do {
            chunk = readChunk();
        } while (ping.equals(chunk));
        return chunk;
    }

    public String readBody() throws IOException {
        int length = Integer.parseInt(headers.get("content-length"));
        return new String(in.readNBytes(length), StandardCharsets.UTF_8);
    }

    private String readLine() throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                break;
            }
            if (b != '\r') {
                buf.write(b);
            }
        }
        if (b == -1 && buf.size() == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.US_ASCII);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
