/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.promfed.proxy.client.BackendResponseException;
import io.promfed.proxy.internal.net.TransportResponse;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.QueryValue.ValueType;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Scalar;
import io.promfed.proxy.model.StringValue;
import io.promfed.proxy.model.Vector;

/**
 * Reads the JSON envelope of the Prometheus HTTP API,
 * {@code {"status": "success"|"error", "data": ..., "errorType": ..., "error": ...}}.
 */
final class PrometheusResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ERROR_BODY = 256;

    private PrometheusResponseParser() {
    }

    static QueryValue parseValue(TransportResponse response) {
        JsonNode data = data(response);
        try {
            ValueType type = ValueType.forWireName(data.path("resultType").asText());
            JsonNode result = data.path("result");
            return switch (type) {
                case MATRIX -> parseMatrix(result);
                case VECTOR -> parseVector(result);
                case SCALAR -> new Scalar(parseValue(result.path(1)), parseTimestamp(result.path(0)));
                case STRING -> new StringValue(result.path(1).asText(), parseTimestamp(result.path(0)));
            };
        }
        catch (IllegalArgumentException e) {
            throw new BackendResponseException(response.status(), "malformed query result: " + e.getMessage(), e);
        }
    }

    static List<String> parseLabelValues(TransportResponse response) {
        JsonNode data = data(response);
        var values = new ArrayList<String>(data.size());
        for (JsonNode value : data) {
            values.add(value.asText());
        }
        return values;
    }

    static List<LabelSet> parseSeries(TransportResponse response) {
        JsonNode data = data(response);
        var series = new ArrayList<LabelSet>(data.size());
        for (JsonNode labels : data) {
            series.add(parseLabels(labels));
        }
        return series;
    }

    private static JsonNode data(TransportResponse response) {
        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        }
        catch (IOException e) {
            throw new BackendResponseException(response.status(), "unexpected response (HTTP " + response.status() + "): " + snippet(response), e);
        }
        if (root == null || !root.isObject()) {
            throw new BackendResponseException(response.status(), null, "unexpected response (HTTP " + response.status() + "): " + snippet(response));
        }
        String status = root.path("status").asText();
        if ("error".equals(status)) {
            String errorType = root.hasNonNull("errorType") ? root.get("errorType").asText() : null;
            throw new BackendResponseException(response.status(), errorType, root.path("error").asText("unknown error"));
        }
        if (!"success".equals(status) || !response.isSuccess()) {
            throw new BackendResponseException(response.status(), null, "unexpected response (HTTP " + response.status() + "): " + snippet(response));
        }
        return root.path("data");
    }

    private static Matrix parseMatrix(JsonNode result) {
        var streams = new ArrayList<SampleStream>(result.size());
        for (JsonNode series : result) {
            var points = new ArrayList<SamplePair>(series.path("values").size());
            for (JsonNode point : series.path("values")) {
                points.add(new SamplePair(parseTimestamp(point.path(0)), parseValue(point.path(1))));
            }
            streams.add(new SampleStream(parseLabels(series.path("metric")), points));
        }
        return new Matrix(streams);
    }

    private static Vector parseVector(JsonNode result) {
        var samples = new ArrayList<Sample>(result.size());
        for (JsonNode sample : result) {
            JsonNode point = sample.path("value");
            samples.add(new Sample(parseLabels(sample.path("metric")), parseValue(point.path(1)), parseTimestamp(point.path(0))));
        }
        return new Vector(samples);
    }

    private static LabelSet parseLabels(JsonNode labels) {
        var builder = LabelSet.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = labels.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            builder.set(field.getKey(), field.getValue().asText());
        }
        return builder.build();
    }

    /**
     * Converts fractional Unix seconds to milliseconds.
     */
    static long parseTimestamp(JsonNode node) {
        if (!node.isNumber() && !node.isTextual()) {
            throw new IllegalArgumentException("missing timestamp");
        }
        return new BigDecimal(node.asText()).movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    static double parseValue(JsonNode node) {
        String text = node.asText();
        return switch (text) {
            case "NaN" -> Double.NaN;
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(text);
        };
    }

    private static String snippet(TransportResponse response) {
        String body = response.bodyAsString();
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
