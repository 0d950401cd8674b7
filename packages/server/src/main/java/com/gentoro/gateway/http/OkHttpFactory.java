package com.gentoro.gateway.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the upstream HTTP clients. Metadata calls (tokens, deployment listings, lifecycle) and
 * inference calls share one connection pool but use different read timeouts, since model
 * generation can take far longer than a listing.
 */
public final class OkHttpFactory {
  private OkHttpFactory() {}

  public static OkHttpClient createMetadataClient(Configuration configuration) {
    return new OkHttpClient.Builder()
        .connectTimeout(
            configuration.getLong("gateway.http.connect-timeout-seconds", 10), TimeUnit.SECONDS)
        .readTimeout(
            configuration.getLong("gateway.http.read-timeout-seconds", 30), TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /** Derives the inference client from {@code base} so both share dispatcher and pool. */
  public static OkHttpClient createInferenceClient(OkHttpClient base, Configuration configuration) {
    return base.newBuilder()
        .readTimeout(
            configuration.getLong("gateway.http.inference-read-timeout-seconds", 120),
            TimeUnit.SECONDS)
        .build();
  }
}
