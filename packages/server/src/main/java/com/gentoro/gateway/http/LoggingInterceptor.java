package com.gentoro.gateway.http;

import java.io.IOException;
import java.util.regex.Pattern;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs upstream traffic at DEBUG with bearer tokens and client secrets masked. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(LoggingInterceptor.class);
  private static final Pattern CLIENT_SECRET = Pattern.compile("(client_secret=)[^&]*");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    log.debug(
        "Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
        request.method(),
        request.url(),
        redact(request.headers()),
        bodyToString(request));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = "Authorization".equalsIgnoreCase(name) ? "Bearer ***" : headers.value(i);
      sb.append(name).append(": ").append(value).append('\n');
    }
    return sb.toString();
  }

  static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return CLIENT_SECRET.matcher(buffer.readUtf8()).replaceAll("$1***");
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
