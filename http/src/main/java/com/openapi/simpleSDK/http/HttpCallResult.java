package com.openapi.simpleSDK.http;

import java.net.http.HttpResponse;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Status, first value of every header and body of one HTTP exchange.
 */
public record HttpCallResult(int statusCode, Map<String, String> headers, String body) {

    public static HttpCallResult fromHttpResponse(HttpResponse<String> response) {
        Map<String, String> headers = new HashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        return new HttpCallResult(response.statusCode(), Collections.unmodifiableMap(headers), response.body());
    }

    /** Header lookup ignoring case, or null. */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isError() {
        return statusCode >= 400;
    }
}
