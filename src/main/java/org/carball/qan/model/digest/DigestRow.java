package org.carball.qan.model.digest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * One row of a statement digest summary table (performance_schema
 * events_statements_summary_by_digest) with its cumulative counters.
 *
 * <p>Timer values are picoseconds. Every {@code SUM_*} column and {@code COUNT_STAR} only
 * grow until the server truncates the table or restarts. {@code MIN_TIMER_WAIT} and
 * {@code MAX_TIMER_WAIT} are extremes, not cumulative. All counters are unsigned 64-bit
 * values held in {@code long}; see {@link UnsignedLongDeserializer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DigestRow(
        @JsonProperty("SCHEMA_NAME") String schema,
        @JsonProperty("DIGEST") String digest,
        @JsonProperty("DIGEST_TEXT") String digestText,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("COUNT_STAR") long countStar,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_TIMER_WAIT") long sumTimerWait,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("MIN_TIMER_WAIT") long minTimerWait,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("MAX_TIMER_WAIT") long maxTimerWait,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_LOCK_TIME") long sumLockTime,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_ERRORS") long sumErrors,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_WARNINGS") long sumWarnings,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_ROWS_AFFECTED") long sumRowsAffected,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_ROWS_SENT") long sumRowsSent,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_ROWS_EXAMINED") long sumRowsExamined,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_CREATED_TMP_DISK_TABLES") long sumCreatedTmpDiskTables,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_CREATED_TMP_TABLES") long sumCreatedTmpTables,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_SELECT_FULL_JOIN") long sumSelectFullJoin,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_SELECT_SCAN") long sumSelectScan,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_SORT_MERGE_PASSES") long sumSortMergePasses,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_SORT_ROWS") long sumSortRows,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_NO_INDEX_USED") long sumNoIndexUsed,
        @JsonDeserialize(using = UnsignedLongDeserializer.class) @JsonProperty("SUM_NO_GOOD_INDEX_USED") long sumNoGoodIndexUsed
) {

    /**
     * Digest and schema together; the same digest runs under several schemas.
     */
    public String identity() {
        return (schema == null ? "" : schema) + "\u0000" + digest;
    }

    /**
     * True when any cumulative counter is smaller than in {@code previous}, which only happens
     * after the server reset its statistics.
     */
    public boolean isBehind(DigestRow previous) {
        return Long.compareUnsigned(countStar, previous.countStar) < 0
                || Long.compareUnsigned(sumTimerWait, previous.sumTimerWait) < 0
                || Long.compareUnsigned(sumLockTime, previous.sumLockTime) < 0
                || Long.compareUnsigned(sumErrors, previous.sumErrors) < 0
                || Long.compareUnsigned(sumWarnings, previous.sumWarnings) < 0
                || Long.compareUnsigned(sumRowsAffected, previous.sumRowsAffected) < 0
                || Long.compareUnsigned(sumRowsSent, previous.sumRowsSent) < 0
                || Long.compareUnsigned(sumRowsExamined, previous.sumRowsExamined) < 0
                || Long.compareUnsigned(sumCreatedTmpDiskTables, previous.sumCreatedTmpDiskTables) < 0
                || Long.compareUnsigned(sumCreatedTmpTables, previous.sumCreatedTmpTables) < 0
                || Long.compareUnsigned(sumSelectFullJoin, previous.sumSelectFullJoin) < 0
                || Long.compareUnsigned(sumSelectScan, previous.sumSelectScan) < 0
                || Long.compareUnsigned(sumSortMergePasses, previous.sumSortMergePasses) < 0
                || Long.compareUnsigned(sumSortRows, previous.sumSortRows) < 0
                || Long.compareUnsigned(sumNoIndexUsed, previous.sumNoIndexUsed) < 0
                || Long.compareUnsigned(sumNoGoodIndexUsed, previous.sumNoGoodIndexUsed) < 0;
    }

    /**
     * Counter-by-counter difference to an earlier row of the same identity. The extremes are
     * carried over from this row as they cannot be differenced. Two's complement subtraction
     * gives the right unsigned delta whenever this row is not behind.
     */
    public DigestRow minus(DigestRow previous) {
        return new DigestRow(
                schema,
                digest,
                digestText,
                countStar - previous.countStar,
                sumTimerWait - previous.sumTimerWait,
                minTimerWait,
                maxTimerWait,
                sumLockTime - previous.sumLockTime,
                sumErrors - previous.sumErrors,
                sumWarnings - previous.sumWarnings,
                sumRowsAffected - previous.sumRowsAffected,
                sumRowsSent - previous.sumRowsSent,
                sumRowsExamined - previous.sumRowsExamined,
                sumCreatedTmpDiskTables - previous.sumCreatedTmpDiskTables,
                sumCreatedTmpTables - previous.sumCreatedTmpTables,
                sumSelectFullJoin - previous.sumSelectFullJoin,
                sumSelectScan - previous.sumSelectScan,
                sumSortMergePasses - previous.sumSortMergePasses,
                sumSortRows - previous.sumSortRows,
                sumNoIndexUsed - previous.sumNoIndexUsed,
                sumNoGoodIndexUsed - previous.sumNoGoodIndexUsed
        );
    }
}
