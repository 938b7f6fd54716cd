package com.gdin.inspection.citegraph.util;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;

public class HttpClientUtil {

    private HttpClientUtil() {
    }

    public static CloseableHttpClient getApacheClient(long timeoutInSeconds) {
        return getApacheClient(timeoutInSeconds, timeoutInSeconds, 20);
    }

    /**
     * 带连接池的 Apache 客户端，不做自动重试，重试由调用方按自己的退避策略处理。
     *
     * @param connectTimeoutSeconds  建连超时
     * @param responseTimeoutSeconds 读超时
     * @param maxConnections         连接池上限（同时也是单路由上限）
     */
    public static CloseableHttpClient getApacheClient(long connectTimeoutSeconds, long responseTimeoutSeconds, int maxConnections) {
        PoolingHttpClientConnectionManager connManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnections)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                        .build())
                .build();
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                .setResponseTimeout(Timeout.ofSeconds(responseTimeoutSeconds))
                .build();
        return HttpClients.custom()
                .setConnectionManager(connManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }
}
