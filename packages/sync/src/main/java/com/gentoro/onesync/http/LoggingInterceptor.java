package com.gentoro.onesync.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status: {}, rate limit remaining: {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code(),
        response.header("X-RateLimit-Remaining", "n/a"));

    if (log.isTraceEnabled()) {
      // Peek so the caller can still consume the body.
      ResponseBody responseBody = response.peekBody(64 * 1024);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }
}
