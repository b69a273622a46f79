package com.linlay.llmclient.transport;

import reactor.core.publisher.Mono;

/**
 * HTTP 传输抽象。非 2xx 状态正常返回由调用方分类；仅网络/IO 失败以 TRANSPORT 错误结束。
 */
public interface HttpTransport {

    Mono<HttpResponse> send(HttpRequest request);

    Mono<HttpStreamResponse> sendStream(HttpRequest request);
}
