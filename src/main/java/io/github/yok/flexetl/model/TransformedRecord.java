package io.github.yok.flexetl.model;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.util.DateTimeValues;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One output unit of the pipeline as stored in the sink.
 *
 * <ul>
 * <li>{@code payload}: JSON form of one source row, escaped for a SQL string literal</li>
 * <li>{@code capturedAt}: capture timestamp (never {@code null})</li>
 * <li>{@code tag}: source table name (never {@code null})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TransformedRecord {

    /**
     * Column holding the serialized row.
     */
    public static final String PAYLOAD = "payload";

    /**
     * Column holding the capture timestamp.
     */
    public static final String DATE_TIME = "date_time";

    /**
     * Column holding the source table name.
     */
    public static final String TAG = "tag";

    private final String payload;
    private final LocalDateTime capturedAt;
    private final String tag;

    /**
     * Creates a record.
     *
     * @param payload escaped JSON payload
     * @param capturedAt capture timestamp
     * @param tag source table name
     */
    public TransformedRecord(String payload, LocalDateTime capturedAt, String tag) {
        this.payload = Preconditions.checkNotNull(payload, "payload must not be null");
        this.capturedAt = Preconditions.checkNotNull(capturedAt, "capturedAt must not be null");
        this.tag = Preconditions.checkNotNull(tag, "tag must not be null");
    }

    /**
     * Builds a record from a projected pipeline row ({@code payload, date_time, tag}).
     *
     * @param row projected row
     * @return record
     * @throws IllegalArgumentException if {@code date_time} cannot be read as a date-time
     */
    public static TransformedRecord fromRow(Map<String, Object> row) {
        LocalDateTime capturedAt = DateTimeValues.parseDayFirst(row.get(DATE_TIME));
        Preconditions.checkArgument(capturedAt != null, "Invalid %s value: %s", DATE_TIME,
                row.get(DATE_TIME));
        return new TransformedRecord((String) row.get(PAYLOAD), capturedAt,
                (String) row.get(TAG));
    }
}
