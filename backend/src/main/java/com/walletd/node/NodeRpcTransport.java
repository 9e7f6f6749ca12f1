package com.walletd.node;

import reactor.core.publisher.Mono;

/**
 * Raw JSON-RPC call against one node endpoint; returns the response body.
 */
public interface NodeRpcTransport {

    Mono<String> call(String endpointUrl, String method, Object params);
}
