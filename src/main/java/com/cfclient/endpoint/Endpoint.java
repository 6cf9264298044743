package com.cfclient.endpoint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One remote call: the method plus its query parameters in documented order. Built per call, never stored.
 */
public record Endpoint(ApiMethod method, Map<String, String> params) {

    public Endpoint {
        Objects.requireNonNull(method, "method");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Renders {@code <apiRoot>/<method>[?query]}. No '?' when there are no parameters.
     */
    public String toUrl(String apiRoot) {
        String path = apiRoot + "/" + method.wireName();
        if (params.isEmpty()) {
            return path;
        }
        return path + "?" + QueryStrings.join(params);
    }
}
