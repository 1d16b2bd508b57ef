package com.specscout.analysis.ai;

import reactor.core.publisher.Mono;

/** Single-turn text completion against a hosted model. */
public interface LlmClient {

    Mono<String> complete(String systemPrompt, String userPrompt);

    /** False when the client has no credentials and every call would fail. */
    boolean available();
}
