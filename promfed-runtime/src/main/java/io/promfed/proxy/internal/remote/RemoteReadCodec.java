/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.remote;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.xerial.snappy.Snappy;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;

import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;

/**
 * Encodes remote read requests and decodes their responses.
 * <p>
 * Messages use the Prometheus remote read protobuf schema ({@code prompb.ReadRequest} and
 * {@code prompb.ReadResponse}) in the {@code SAMPLES} response type, framed with snappy block compression.
 * Only the fields this proxy uses are written, unknown fields are skipped when reading.
 * </p>
 */
public final class RemoteReadCodec {

    public static final String CONTENT_TYPE = "application/x-protobuf";
    public static final String CONTENT_ENCODING = "snappy";
    public static final String VERSION_HEADER = "X-Prometheus-Remote-Read-Version";
    public static final String VERSION = "0.1.0";

    // ReadRequest
    static final int READ_REQUEST_QUERIES = 1;
    // Query
    static final int QUERY_START_MS = 1;
    static final int QUERY_END_MS = 2;
    static final int QUERY_MATCHERS = 3;
    // LabelMatcher
    static final int MATCHER_TYPE = 1;
    static final int MATCHER_NAME = 2;
    static final int MATCHER_VALUE = 3;
    // ReadResponse
    static final int READ_RESPONSE_RESULTS = 1;
    // QueryResult
    static final int QUERY_RESULT_TIMESERIES = 1;
    // TimeSeries
    static final int TIMESERIES_LABELS = 1;
    static final int TIMESERIES_SAMPLES = 2;
    // Label
    static final int LABEL_NAME = 1;
    static final int LABEL_VALUE = 2;
    // Sample
    static final int SAMPLE_VALUE = 1;
    static final int SAMPLE_TIMESTAMP = 2;

    private RemoteReadCodec() {
    }

    /**
     * @return the compressed request selecting {@code matchers} over {@code [start, end]}
     */
    public static byte[] encodeRequest(Instant start, Instant end, List<LabelMatcher> matchers) {
        byte[] query = message(out -> {
            out.writeInt64(QUERY_START_MS, start.toEpochMilli());
            out.writeInt64(QUERY_END_MS, end.toEpochMilli());
            for (LabelMatcher matcher : matchers) {
                out.writeByteArray(QUERY_MATCHERS, message(m -> {
                    m.writeEnum(MATCHER_TYPE, matcherType(matcher));
                    m.writeString(MATCHER_NAME, matcher.name());
                    m.writeString(MATCHER_VALUE, matcher.value());
                }));
            }
        });
        byte[] request = message(out -> out.writeByteArray(READ_REQUEST_QUERIES, query));
        try {
            return Snappy.compress(request);
        }
        catch (IOException e) {
            throw new UncheckedIOException("cannot compress remote read request", e);
        }
    }

    /**
     * Decodes a compressed response, merging the results of all its queries into one matrix.
     *
     * @throws IOException if the response is not a valid compressed {@code ReadResponse}
     */
    public static Matrix decodeResponse(byte[] compressed) throws IOException {
        byte[] raw = Snappy.uncompress(compressed);
        var streams = new ArrayList<SampleStream>();
        CodedInputStream in = CodedInputStream.newInstance(raw);
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isField(tag, READ_RESPONSE_RESULTS, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                readQueryResult(CodedInputStream.newInstance(in.readByteArray()), streams);
            }
            else {
                in.skipField(tag);
            }
        }
        return new Matrix(streams);
    }

    private static void readQueryResult(CodedInputStream in, List<SampleStream> streams) throws IOException {
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isField(tag, QUERY_RESULT_TIMESERIES, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                streams.add(readTimeSeries(CodedInputStream.newInstance(in.readByteArray())));
            }
            else {
                in.skipField(tag);
            }
        }
    }

    private static SampleStream readTimeSeries(CodedInputStream in) throws IOException {
        var labels = LabelSet.builder();
        var points = new ArrayList<SamplePair>();
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isField(tag, TIMESERIES_LABELS, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                readLabel(CodedInputStream.newInstance(in.readByteArray()), labels);
            }
            else if (isField(tag, TIMESERIES_SAMPLES, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                points.add(readSample(CodedInputStream.newInstance(in.readByteArray())));
            }
            else {
                in.skipField(tag);
            }
        }
        points.sort(Comparator.comparingLong(SamplePair::timestamp));
        return new SampleStream(labels.build(), points);
    }

    private static void readLabel(CodedInputStream in, LabelSet.Builder labels) throws IOException {
        String name = "";
        String value = "";
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isField(tag, LABEL_NAME, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                name = in.readString();
            }
            else if (isField(tag, LABEL_VALUE, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                value = in.readString();
            }
            else {
                in.skipField(tag);
            }
        }
        if (name.isEmpty()) {
            throw new IOException("remote read response holds a label without a name");
        }
        labels.set(name, value);
    }

    private static SamplePair readSample(CodedInputStream in) throws IOException {
        double value = 0;
        long timestamp = 0;
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isField(tag, SAMPLE_VALUE, WireFormat.WIRETYPE_FIXED64)) {
                value = in.readDouble();
            }
            else if (isField(tag, SAMPLE_TIMESTAMP, WireFormat.WIRETYPE_VARINT)) {
                timestamp = in.readInt64();
            }
            else {
                in.skipField(tag);
            }
        }
        return new SamplePair(timestamp, value);
    }

    private static boolean isField(int tag, int fieldNumber, int wireType) {
        return WireFormat.getTagFieldNumber(tag) == fieldNumber && WireFormat.getTagWireType(tag) == wireType;
    }

    private static int matcherType(LabelMatcher matcher) {
        return switch (matcher.type()) {
            case EQUAL -> 0;
            case NOT_EQUAL -> 1;
            case REGEX -> 2;
            case NOT_REGEX -> 3;
        };
    }

    @FunctionalInterface
    interface MessageWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    static byte[] message(MessageWriter writer) {
        var bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.write(out);
            out.flush();
        }
        catch (IOException e) {
            // writing to memory does not fail
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
