package com.stockaid.service;

import com.stockaid.exception.MissingArgumentException;
import com.stockaid.model.Endpoint;
import com.stockaid.model.KeyChain;
import com.stockaid.transport.OutgoingRequest;
import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.StringSubstitutor;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shapes the request for one call of an API from the caller's arguments and the key chain.
 *
 * Url params fill {@code {name}} placeholders of the url. Data params, plus the key map's secrets,
 * become query parameters, or fill {@code ${name}} placeholders of the JSON body template when the
 * API declares one.
 */
public class RequestFactory {

    private final KeyChain keyChain;

    public RequestFactory(KeyChain keyChain) {
        this.keyChain = keyChain;
    }

    public OutgoingRequest create(Endpoint endpoint, Map<String, ?> args) {
        OutgoingRequest.OutgoingRequestBuilder request = OutgoingRequest.builder()
                .method(endpoint.getMethod())
                .url(url(endpoint, args));

        Map<String, String> data = data(endpoint, args);
        if (endpoint.getData() != null && !endpoint.getData().isEmpty()) {
            request.body(body(endpoint.getData(), data));
        } else {
            request.queryParams(data);
        }
        return request.build();
    }

    String url(Endpoint endpoint, Map<String, ?> args) {
        Map<String, String> values = new HashMap<>();
        for (String param : endpoint.getUrlParams()) {
            values.put(param, UriUtils.encodePathSegment(require(endpoint, args, param), StandardCharsets.UTF_8));
        }
        StringSubstitutor substitutor = new StringSubstitutor(values, "{", "}", '\\');
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(endpoint.getUrl());
    }

    /**
     * Outgoing fields: declared data params from the arguments, then key chain secrets.
     * Secrets win over arguments with the same field name.
     */
    Map<String, String> data(Endpoint endpoint, Map<String, ?> args) {
        Map<String, String> data = new LinkedHashMap<>();
        for (String param : endpoint.getDataParams()) {
            data.put(param, require(endpoint, args, param));
        }
        for (Map.Entry<String, String> entry : endpoint.getKeyMap().entrySet()) {
            data.put(entry.getKey(), keyChain.resolve(entry.getValue()));
        }
        return data;
    }

    String body(String template, Map<String, String> data) {
        Map<String, String> escaped = new HashMap<>();
        data.forEach((k, v) -> escaped.put(k, StringEscapeUtils.escapeJson(v)));
        StringSubstitutor substitutor = new StringSubstitutor(escaped);
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(template);
    }

    static String require(Endpoint endpoint, Map<String, ?> args, String param) {
        Object value = args.get(param);
        if (value == null) {
            throw new MissingArgumentException(endpoint.getProvider() + "." + endpoint.getName(), param);
        }
        return String.valueOf(value);
    }
}
