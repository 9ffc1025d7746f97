package com.cape.runtime.model;

/**
 * @param content    generated text
 * @param tokensUsed tokens consumed by the call, 0 when the adapter does not report usage
 */
public record AdapterResponse(String content, long tokensUsed) {

    public static AdapterResponse of(String content) {
        return new AdapterResponse(content, 0);
    }
}
