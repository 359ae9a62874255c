package me.golemcore.clarity.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp interceptor for gateway tests. Never touches the network:
 * tests enqueue responses or failures, and every request is captured.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));
        requestCount.incrementAndGet();

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .body(ResponseBody.create(next.body(), JSON))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, IOException failure) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String query(String name) {
            return request.url().queryParameter(name);
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
