package com.cfclient.decode;

import com.cfclient.common.CodeforcesApiException;
import com.cfclient.common.CodeforcesDecodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a response body into a list of results or a typed failure.
 * <p>
 * Decoding is lenient about shape drift: unknown fields are ignored, missing fields stay null,
 * unknown enum constants become null and a bare object is accepted where a list is declared.
 */
public class ResponseDecoder {

    private final ObjectMapper objectMapper;

    public ResponseDecoder() {
        this(new ObjectMapper());
    }

    /**
     * @param objectMapper base mapper; a copy is taken and made lenient, the argument is not modified.
     *                     Wire names are camelCase, so the copy always uses the default naming strategy.
     */
    public ResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    /**
     * Decode and unwrap: OK gives the normalized result list, any other status throws.
     *
     * @throws CodeforcesApiException      status is not OK
     * @throws CodeforcesDecodingException body is not a valid envelope of elementType
     */
    public <T> List<T> decode(byte[] body, Class<T> elementType) {
        ApiEnvelope<T> envelope = decodeEnvelope(body, elementType);
        if (!envelope.isOk()) {
            throw new CodeforcesApiException(envelope.comment());
        }
        return envelope.result().toList();
    }

    /**
     * Decode the envelope only. On a non-OK status the result is not read and is always absent.
     */
    public <T> ApiEnvelope<T> decodeEnvelope(byte[] body, Class<T> elementType) {
        JsonNode root = readTree(body);
        if (!root.isObject()) {
            throw new CodeforcesDecodingException("Response is not a JSON object");
        }
        JsonNode status = root.get("status");
        if (status == null || !status.isTextual()) {
            throw new CodeforcesDecodingException("Response has no status field");
        }
        JsonNode comment = root.get("comment");
        String commentText = comment == null || comment.isNull() ? null : comment.asText();
        if (!ApiEnvelope.STATUS_OK.equals(status.asText())) {
            return new ApiEnvelope<>(status.asText(), commentText, ResultShape.absent());
        }
        return new ApiEnvelope<>(status.asText(), commentText, readResult(root.get("result"), elementType));
    }

    <T> ResultShape<T> readResult(JsonNode result, Class<T> elementType) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return ResultShape.absent();
        }
        if (result.isArray()) {
            List<T> values = new ArrayList<>(result.size());
            for (JsonNode element : result) {
                values.add(convert(element, elementType));
            }
            return ResultShape.many(values);
        }
        return ResultShape.single(convert(result, elementType));
    }

    private <T> T convert(JsonNode node, Class<T> elementType) {
        try {
            return objectMapper.treeToValue(node, elementType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodeforcesDecodingException(
                    "Cannot decode result as " + elementType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(byte[] body) {
        if (body == null || body.length == 0) {
            throw new CodeforcesDecodingException("Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CodeforcesDecodingException("Response is not valid JSON: " + e.getMessage(), e);
        }
    }
}
