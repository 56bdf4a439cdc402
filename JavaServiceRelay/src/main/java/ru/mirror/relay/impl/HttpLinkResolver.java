package ru.mirror.relay.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.protocol.RedirectLocations;
import org.apache.hc.client5.http.routing.RoutingSupport;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.util.Timeout;
import ru.mirror.relay.LinkResolver;
import ru.mirror.relay.impl.settings.LinkSettings;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

@Slf4j
public class HttpLinkResolver implements LinkResolver, Closeable {
    private final CloseableHttpClient httpClient;
    private final List<String> productMarkers;

    public HttpLinkResolver(LinkSettings linkSettings) {
        Timeout timeout = Timeout.ofSeconds(linkSettings.getTimeoutSec());
        this.httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(timeout)
                                .setSocketTimeout(timeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .setRedirectsEnabled(true)
                        .build())
                .setUserAgent(linkSettings.getUserAgent())
                .build();
        this.productMarkers = List.copyOf(linkSettings.getProductMarkers());
    }

    @Override
    public String resolve(String url) {
        HttpGet request;
        try {
            request = new HttpGet(url);
        } catch (IllegalArgumentException e) {
            log.error("Failed to expand {}: {}", url, e.getMessage());
            return url;
        }
        HttpClientContext context = HttpClientContext.create();
        // тело ответа не читаем, нужен только адрес после редиректов
        try (ClassicHttpResponse response = httpClient.executeOpen(RoutingSupport.determineHost(request), request, context)) {
            log.debug("EXPAND_RESPONSE {} {}", url, response.getCode());
            return canonicalize(finalLocation(request, context), productMarkers);
        } catch (IOException | HttpException | URISyntaxException e) {
            log.error("Failed to expand {}: {}", url, e.getMessage());
            return url;
        }
    }

    static String canonicalize(String finalUrl, List<String> productMarkers) {
        int query = finalUrl.indexOf('?');
        if (query < 0) {
            return finalUrl;
        }
        // маркер ищем только до '?', в параметрах он ничего не значит
        String beforeQuery = finalUrl.substring(0, query);
        for (String marker : productMarkers) {
            if (beforeQuery.contains(marker)) {
                return beforeQuery;
            }
        }
        return finalUrl;
    }

    private static String finalLocation(HttpGet request, HttpClientContext context) throws URISyntaxException {
        RedirectLocations redirects = context.getRedirectLocations();
        if (redirects == null || redirects.size() == 0) {
            return request.getUri().toString();
        }
        URI last = redirects.get(redirects.size() - 1);
        return last.toString();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
