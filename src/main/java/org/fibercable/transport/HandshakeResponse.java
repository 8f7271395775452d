package org.fibercable.transport;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public class HandshakeResponse {

    private static final HandshakeResponse ACCEPTED = new HandshakeResponse(101, "Switching Protocols", null, "");
    private static final HandshakeResponse NOT_FOUND = new HandshakeResponse(404, "Not Found", "text/plain", "Page not found");

    private final int statusCode;
    private final String statusTxt;
    private final String contentType;
    private final String body;

    public HandshakeResponse(int statusCode, String statusTxt, String contentType, String body) {
        this.statusCode = statusCode;
        this.statusTxt = statusTxt;
        this.contentType = contentType;
        this.body = body;
    }

    public static HandshakeResponse accepted() {
        return ACCEPTED;
    }

    public static HandshakeResponse notFound() {
        return NOT_FOUND;
    }

    public boolean isAccepted() {
        return statusCode == 101;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getStatusTxt() {
        return statusTxt;
    }

    public String getContentType() {
        return contentType;
    }

    public String getBody() {
        return body;
    }

    public byte[] toHttpBytes() {
        return toHttpBytes(StandardCharsets.US_ASCII);
    }

    public byte[] toHttpBytes(Charset charset) {
        byte[] content = body.getBytes(charset);
        StringBuilder response = new StringBuilder();
        response.append("HTTP/1.1 ").append(statusCode).append(' ').append(statusTxt).append("\r\n");
        if (contentType != null) {
            response.append("Content-Type: ").append(contentType).append("\r\n");
        }
        response.append("Content-Length: ").append(content.length).append("\r\n\r\n");
        response.append(body);
        return response.toString().getBytes(charset);
    }

    @Override
    public String toString() {
        return "HandshakeResponse{" + statusCode + " " + statusTxt + '}';
    }
}
