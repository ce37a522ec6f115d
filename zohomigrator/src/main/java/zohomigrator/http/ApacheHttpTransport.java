package zohomigrator.http;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} backed by Apache HttpClient 5 (classic blocking API).
 */
public final class ApacheHttpTransport implements HttpTransport, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ApacheHttpTransport.class);

    private final CloseableHttpClient client;

    public ApacheHttpTransport(Duration timeout) {
        Timeout t = Timeout.ofMilliseconds(timeout.toMillis());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(t)
                .setResponseTimeout(t)
                .build();
        this.client = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public HttpResult send(HttpCall call) throws IOException {
        ClassicRequestBuilder builder = ClassicRequestBuilder.create(call.method()).setUri(call.uri());
        for (Map.Entry<String, String> header : call.headers().entrySet()) {
            builder.addHeader(header.getKey(), header.getValue());
        }
        builder.addHeader("Accept", HttpCall.JSON);
        if (call.body() != null) {
            ContentType type = call.contentType() != null
                    ? ContentType.create(call.contentType(), StandardCharsets.UTF_8)
                    : ContentType.APPLICATION_JSON;
            builder.setEntity(call.body(), type);
        } else if (call.contentType() != null) {
            builder.addHeader("Content-Type", call.contentType());
        }

        log.debug("{} {}", call.method(), call.uri().getPath());
        return client.execute(builder.build(), response -> new HttpResult(
                response.getCode(),
                response.getEntity() != null
                        ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                        : ""));
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
