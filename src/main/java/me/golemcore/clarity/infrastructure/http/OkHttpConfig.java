package me.golemcore.clarity.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared pooled {@link OkHttpClient}. Adapters derive per-call-type clients
 * from it with {@code newBuilder()} so they share the connection pool. Every
 * request carries a {@code clarity-java/<version>} user agent unless the
 * caller set one.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final ClarityProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        ClarityProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(userAgent(userAgentValue()))
                .retryOnConnectionFailure(true)
                .build();
    }

    String userAgentValue() {
        ClarityProperties.ReflectProperties reflect = properties.getReflect();
        return reflect.getClient() + "/" + reflect.getAppVersion();
    }

    private static Interceptor userAgent(String value) {
        return chain -> {
            if (chain.request().header("User-Agent") != null) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder().header("User-Agent", value).build());
        };
    }
}
