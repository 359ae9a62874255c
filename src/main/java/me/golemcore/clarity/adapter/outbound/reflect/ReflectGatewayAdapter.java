package me.golemcore.clarity.adapter.outbound.reflect;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.exception.ReflectGatewayException;
import me.golemcore.clarity.domain.model.CapsuleSnapshot;
import me.golemcore.clarity.domain.model.ReflectRequest;
import me.golemcore.clarity.domain.model.ReflectResponse;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.StepsProgramme;
import me.golemcore.clarity.domain.model.StepsResponse;
import me.golemcore.clarity.domain.model.TalkRequest;
import me.golemcore.clarity.domain.model.TalkResponse;
import me.golemcore.clarity.domain.service.ContentFingerprint;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.port.outbound.ReflectGatewayPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reflect gateway adapter: JSON over HTTP to the hosted reasoning functions.
 *
 * <p>
 * Endpoints, relative to {@code clarity.reflect.base-url}:
 * <ul>
 * <li>POST /cloudtap-reflect, /cloudtap-options, /cloudtap-questions,
 * /cloudtap-clarity-perspective - single-shot tools
 * <li>POST /cloudtap-talkitthrough - multi-turn talk
 * <li>GET /reflect-steps, /focus-steps, /practice-steps?programme= - content
 * lists
 * </ul>
 *
 * <p>
 * A base URL whose last path segment starts with {@code cloudtap-} is treated
 * as a full endpoint URL; that segment is replaced by the endpoint being
 * called.
 *
 * <p>
 * Generative calls use {@code clarity.reflect.generative-timeout-seconds},
 * content lists use {@code clarity.reflect.metadata-timeout-seconds}. Request
 * bodies are never logged; the debug trace carries a payload fingerprint and
 * the snapshot's preference and cue counts.
 *
 * <p>
 * A response missing a required field ({@code text} for tools and talk,
 * {@code response_id} for talk, {@code steps} for content lists) is a
 * decoding failure, the same as an unparseable body.
 *
 * @see me.golemcore.clarity.port.outbound.ReflectGatewayPort
 */
@Component
@Slf4j
public class ReflectGatewayAdapter implements ReflectGatewayPort {

    static final String TALK_ENDPOINT = "cloudtap-talkitthrough";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String ENDPOINT_PREFIX = "cloudtap-";

    private final ClarityProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient generativeClient;
    private final OkHttpClient metadataClient;

    public ReflectGatewayAdapter(ClarityProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        ClarityProperties.ReflectProperties reflect = properties.getReflect();
        this.generativeClient = baseHttpClient.newBuilder()
                .callTimeout(reflect.getGenerativeTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(reflect.getGenerativeTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        this.metadataClient = baseHttpClient.newBuilder()
                .callTimeout(reflect.getMetadataTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(reflect.getMetadataTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public ReflectResponse runTool(ReflectTool tool, ReflectRequest request) {
        ReflectResponse response = post(tool.getEndpoint(), request, request.capsule(), ReflectResponse.class);
        requireField(response.text(), "text", tool.getEndpoint());
        return response;
    }

    @Override
    public TalkResponse talk(TalkRequest request) {
        TalkResponse response = post(TALK_ENDPOINT, request, request.capsule(), TalkResponse.class);
        requireField(response.text(), "text", TALK_ENDPOINT);
        requireField(response.responseId(), "response_id", TALK_ENDPOINT);
        return response;
    }

    @Override
    public StepsResponse steps(StepsProgramme kind, String programme) {
        requireAvailable();
        String slug = programme != null && !programme.isBlank() ? programme : kind.getDefaultProgramme();
        HttpUrl url = resolveUrl(kind.getEndpoint()).newBuilder()
                .addQueryParameter("programme", slug)
                .build();

        Request request = authorized(new Request.Builder().url(url).get()).build();
        log.debug("[Reflect] GET {} programme={}", kind.getEndpoint(), slug);
        StepsResponse response = execute(metadataClient, request, kind.getEndpoint(), StepsResponse.class);
        requireField(response.steps(), "steps", kind.getEndpoint());
        return response;
    }

    @Override
    public boolean isAvailable() {
        ClarityProperties.ReflectProperties reflect = properties.getReflect();
        return reflect.isEnabled()
                && reflect.getBaseUrl() != null && !reflect.getBaseUrl().isBlank()
                && reflect.getAnonKey() != null && !reflect.getAnonKey().isBlank()
                && HttpUrl.parse(reflect.getBaseUrl()) != null;
    }

    private <T> T post(String endpoint, Object payload, CapsuleSnapshot snapshot, Class<T> responseType) {
        requireAvailable();
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request for " + endpoint, e);
        }

        if (log.isDebugEnabled()) {
            log.debug("[Reflect] POST {} payload={} prefs={} cues={}", endpoint, ContentFingerprint.fnv1a64(body),
                    snapshot != null && snapshot.getPreferences() != null ? snapshot.getPreferences().size() : 0,
                    snapshot != null && snapshot.getLearnedCues() != null ? snapshot.getLearnedCues().size() : 0);
        }

        Request request = authorized(new Request.Builder()
                .url(resolveUrl(endpoint))
                .post(RequestBody.create(body, JSON)))
                .build();
        return execute(generativeClient, request, endpoint, responseType);
    }

    private <T> T execute(OkHttpClient client, Request request, String endpoint, Class<T> responseType) {
        String responseText;
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            responseText = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Reflect] {} failed: HTTP {}", endpoint, response.code());
                throw ReflectGatewayException.http(response.code(), responseText);
            }
        } catch (IOException e) {
            log.warn("[Reflect] {} network error: {}", endpoint, e.getMessage());
            throw ReflectGatewayException.network(e);
        }

        try {
            T parsed = objectMapper.readValue(responseText, responseType);
            if (parsed == null) {
                throw ReflectGatewayException.decoding(new IllegalStateException("Empty response body"));
            }
            log.debug("[Reflect] {} succeeded ({} chars)", endpoint, responseText.length());
            return parsed;
        } catch (JsonProcessingException e) {
            log.warn("[Reflect] {} returned an undecodable body", endpoint);
            throw ReflectGatewayException.decoding(e);
        }
    }

    private static void requireField(Object value, String field, String endpoint) {
        if (value == null) {
            log.warn("[Reflect] {} response is missing '{}'", endpoint, field);
            throw ReflectGatewayException.decoding(
                    new IllegalStateException("Missing '" + field + "' in " + endpoint + " response"));
        }
    }

    private Request.Builder authorized(Request.Builder builder) {
        String key = properties.getReflect().getAnonKey();
        return builder
                .header("Authorization", "Bearer " + key)
                .header("apikey", key)
                .header("Accept", "application/json");
    }

    HttpUrl resolveUrl(String endpoint) {
        HttpUrl base = HttpUrl.get(properties.getReflect().getBaseUrl());
        List<String> segments = base.pathSegments();
        HttpUrl.Builder builder = base.newBuilder();
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last).isEmpty()) {
            builder.removePathSegment(last);
            last--;
        }
        if (last >= 0 && segments.get(last).startsWith(ENDPOINT_PREFIX)) {
            builder.removePathSegment(last);
        }
        return builder.addPathSegment(endpoint).build();
    }

    private void requireAvailable() {
        if (!isAvailable()) {
            throw ReflectGatewayException.unavailable(properties.getReflect().isEnabled()
                    ? "base URL or key not configured"
                    : "disabled");
        }
    }
}
