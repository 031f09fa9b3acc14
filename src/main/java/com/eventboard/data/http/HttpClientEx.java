package com.eventboard.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：承载 http 模块 的关键逻辑，对外提供可复用的调用入口。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx() {
        this(Duration.ofSeconds(20), "EventBoard/1.0");
    }

    public HttpClientEx(Duration connectTimeout, String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout == null ? Duration.ofSeconds(20) : connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "EventBoard/1.0" : userAgent.trim();
    }

/**
 * 方法说明：get，负责获取数据并返回结果。
 * 处理流程：发送一次 GET 请求，任何状态码都原样返回；连接或超时失败时抛出 IOException。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public Response get(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new Response(resp.statusCode(), resp.body());
    }

    /**
     * Joins base URL and path and appends the query parameters in iteration order.
     */
    public static String buildUrl(String baseUrl, String path, Map<String, String> query) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String p = path == null ? "" : path.trim();
        if (!p.isEmpty() && !p.startsWith("/")) {
            p = "/" + p;
        }
        StringBuilder sb = new StringBuilder(base).append(p);
        if (query != null && !query.isEmpty()) {
            char sep = '?';
            for (Map.Entry<String, String> entry : query.entrySet()) {
                sb.append(sep)
                        .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
                sep = '&';
            }
        }
        return sb.toString();
    }

    public static final class Response {
        public final int statusCode;
        public final String body;

        public Response(int statusCode, String body) {
            this.statusCode = statusCode;
            this.body = body == null ? "" : body;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
