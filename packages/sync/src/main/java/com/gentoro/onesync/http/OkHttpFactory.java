package com.gentoro.onesync.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

/** Builds the HTTP client used against the content host. */
public class OkHttpFactory {
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  static final Duration READ_TIMEOUT = Duration.ofSeconds(20);

  private OkHttpFactory() {}

  /** A client with bounded connect and read timeouts; no retries beyond OkHttp's own. */
  public static OkHttpClient create() {
    return new OkHttpClient.Builder()
        .connectTimeout(CONNECT_TIMEOUT)
        .readTimeout(READ_TIMEOUT)
        .followRedirects(true)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
