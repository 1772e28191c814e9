package com.repstack.util;

import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;

/**
 * Generative text backend. Implementations never throw and never retry:
 * every transport, HTTP or parse problem comes back as {@link LlmResponse#failure(String)}.
 */
public interface LlmGateway {

    LlmResponse generate(LlmRequest request);

    boolean isConfigured();
}
