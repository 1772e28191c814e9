package com.repstack.util;

/**
 * Text embedding backend. {@link #embed(String)} returns null instead of throwing.
 */
public interface EmbeddingClient {

    boolean isConfigured();

    float[] embed(String text);
}
