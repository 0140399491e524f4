package com.gentoro.onesync.source;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

/** OkHttp interceptor serving canned responses keyed by full URL; anything else is a 404. */
public class FakeGitHub implements Interceptor {
  record Canned(int code, String body, Map<String, String> headers) {}

  private final Map<String, Canned> routes = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
  private volatile boolean offline;

  public void ok(String url, String body) {
    routes.put(url, new Canned(200, body, Map.of()));
  }

  public void respond(String url, int code, Map<String, String> headers) {
    routes.put(url, new Canned(code, "{\"message\":\"error\"}", headers));
  }

  public void setOffline(boolean offline) {
    this.offline = offline;
  }

  public int hits(String url) {
    AtomicInteger count = hits.get(url);
    return count == null ? 0 : count.get();
  }

  @NotNull
  @Override
  public Response intercept(@NotNull Chain chain) throws IOException {
    String url = chain.request().url().toString();
    hits.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
    if (offline) {
      throw new IOException("connection refused");
    }
    Canned canned = routes.getOrDefault(url, new Canned(404, "Not Found", Map.of()));
    Response.Builder builder =
        new Response.Builder()
            .request(chain.request())
            .protocol(Protocol.HTTP_1_1)
            .code(canned.code())
            .message("canned")
            .body(ResponseBody.create(canned.body(), MediaType.get("text/plain")));
    canned.headers().forEach(builder::header);
    return builder.build();
  }
}
