package com.cfclient.endpoint;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Query-string encoding shared by the endpoint builder and the request signer.
 * Form encoding (space as '+'), with ';' kept literal so handle and tag lists survive unescaped.
 * Unreserved set is letters, digits and "_.-~".
 */
public final class QueryStrings {

    private QueryStrings() {
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~")
                .replace("%3B", ";");
    }

    public static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    /**
     * Joins pairs in iteration order as key=value separated by '&'. Empty map gives "".
     */
    public static String join(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> e : params.entrySet()) {
            joiner.add(encode(e.getKey()) + "=" + encode(e.getValue()));
        }
        return joiner.toString();
    }

    /**
     * Splits on '&' then on the first '='. Entries without '=' are dropped; a repeated key keeps the last value.
     */
    public static Map<String, String> parse(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (pair.isEmpty() || eq < 0) {
                continue;
            }
            params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
        }
        return params;
    }
}
