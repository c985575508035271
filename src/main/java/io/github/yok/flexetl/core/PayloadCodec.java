package io.github.yok.flexetl.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.io.BaseEncoding;
import io.github.yok.flexetl.util.DateTimeValues;
import io.github.yok.flexetl.util.EtlException;
import io.github.yok.flexetl.util.SqlUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Generated;

/**
 * Serializes one record into the payload column and back.
 *
 * <p>
 * The payload is a JSON object in column order. Temporal values are written as text
 * ({@code yyyy-MM-dd HH:mm:ss} for date-times), binary values as upper-case hex, decimals in plain
 * notation. The JSON text is then escaped with {@link SqlUtils#escapeLiteral(String)} so it can be
 * embedded in a single-quoted SQL literal as is.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class PayloadCodec {

    private static final ObjectMapper MAPPER =
            JsonMapper.builder().enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN).build();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    @Generated
    private PayloadCodec() {}

    /**
     * Serializes a record.
     *
     * @param record column-to-value map
     * @return escaped JSON payload
     * @throws EtlException if the record cannot be serialized
     */
    public static String encode(Map<String, Object> record) {
        Map<String, Object> json = new LinkedHashMap<>();
        record.forEach((key, value) -> json.put(key, toJsonValue(value)));
        try {
            return SqlUtils.escapeLiteral(MAPPER.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new EtlException("Failed to serialize record payload", e);
        }
    }

    /**
     * Parses a payload produced by {@link #encode(Map)}.
     *
     * @param payload escaped JSON payload
     * @return column-to-value map in payload order
     * @throws EtlException if the payload is not a JSON object
     */
    public static Map<String, Object> decode(String payload) {
        try {
            return MAPPER.readValue(SqlUtils.unescapeLiteral(payload), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EtlException("Failed to parse record payload", e);
        }
    }

    private static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        if (DateTimeValues.isTemporal(value)) {
            return DateTimeValues.toText(value);
        }
        if (value instanceof byte[]) {
            return BaseEncoding.base16().encode((byte[]) value);
        }
        return String.valueOf(value);
    }
}
