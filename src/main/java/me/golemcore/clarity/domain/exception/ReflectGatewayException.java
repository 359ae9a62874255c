package me.golemcore.clarity.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Failure of a call to the remote reasoning service.
 *
 * <p>
 * {@link Kind#UNAVAILABLE} is raised before any request is attempted, so
 * callers can short-circuit to local content. {@link Kind#HTTP} carries the
 * status code and raw body for diagnostics. None of the kinds is retried.
 */
public class ReflectGatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNAVAILABLE, HTTP, DECODING, NETWORK
    }

    private final Kind kind;
    private final int statusCode;
    private final String responseBody;

    private ReflectGatewayException(Kind kind, String message, int statusCode, String responseBody,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public static ReflectGatewayException unavailable(String reason) {
        return new ReflectGatewayException(Kind.UNAVAILABLE, "Reflect gateway unavailable: " + reason, 0, null,
                null);
    }

    public static ReflectGatewayException http(int statusCode, String body) {
        return new ReflectGatewayException(Kind.HTTP, "Reflect gateway returned HTTP " + statusCode, statusCode,
                body, null);
    }

    public static ReflectGatewayException decoding(Throwable cause) {
        return new ReflectGatewayException(Kind.DECODING, "Failed to decode reflect gateway response", 0, null,
                cause);
    }

    public static ReflectGatewayException network(Throwable cause) {
        return new ReflectGatewayException(Kind.NETWORK, "Reflect gateway network error: " + cause.getMessage(), 0,
                null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
