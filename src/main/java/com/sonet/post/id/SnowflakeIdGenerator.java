package com.sonet.post.id;

import com.sonet.config.IdProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.LongSupplier;

/**
 * Thread-safe Snowflake ids: 41-bit timestamp, 5-bit datacenter, 5-bit worker, 12-bit sequence.
 * Ids from one generator increase strictly, so they double as a creation-order tiebreaker.
 */
@Component
public class SnowflakeIdGenerator {
    private static final long EPOCH = 1704067200000L; // 2024-01-01T00:00:00Z

    private static final long WORKER_ID_BITS = 5L;
    private static final long DATACENTER_ID_BITS = 5L;
    private static final long SEQUENCE_BITS = 12L;

    private static final long MAX_WORKER_ID = ~(-1L << WORKER_ID_BITS);
    private static final long MAX_DATACENTER_ID = ~(-1L << DATACENTER_ID_BITS);

    private static final long WORKER_ID_SHIFT = SEQUENCE_BITS;
    private static final long DATACENTER_ID_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS;
    private static final long TIMESTAMP_LEFT_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS + DATACENTER_ID_BITS;
    private static final long SEQUENCE_MASK = ~(-1L << SEQUENCE_BITS);

    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long datacenterId;
    private final long workerId;
    private final LongSupplier clock;

    private long lastTimestamp = -1L;
    private long sequence = 0L;

    @Autowired
    public SnowflakeIdGenerator(IdProperties props) {
        this(props.getDatacenterId(), props.getWorkerId(), System::currentTimeMillis);
    }

    public SnowflakeIdGenerator(long datacenterId, long workerId, LongSupplier clock) {
        if (workerId > MAX_WORKER_ID || workerId < 0) {
            throw new IllegalArgumentException("workerId out of range: " + workerId);
        }
        if (datacenterId > MAX_DATACENTER_ID || datacenterId < 0) {
            throw new IllegalArgumentException("datacenterId out of range: " + datacenterId);
        }
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.clock = clock;
    }

    public synchronized long nextId() {
        long timestamp = clock.getAsLong();

        if (timestamp < lastTimestamp) {
            long offset = lastTimestamp - timestamp;
            if (offset > MAX_BACKWARD_DRIFT_MS) {
                throw new IllegalStateException("Clock moved backwards by " + offset + "ms, refusing to generate id");
            }
            // small NTP corrections: keep issuing ids on the last timestamp
            timestamp = lastTimestamp;
        }

        if (lastTimestamp == timestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                timestamp = waitNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0L;
        }

        lastTimestamp = timestamp;

        return ((timestamp - EPOCH) << TIMESTAMP_LEFT_SHIFT)
                | (datacenterId << DATACENTER_ID_SHIFT)
                | (workerId << WORKER_ID_SHIFT)
                | sequence;
    }

    /**
     * Post ids are opaque strings; this is the decimal form of {@link #nextId()}.
     */
    public String nextIdString() {
        return Long.toString(nextId());
    }

    private long waitNextMillis(long last) {
        long timestamp = clock.getAsLong();
        while (timestamp <= last) {
            timestamp = clock.getAsLong();
        }
        return timestamp;
    }
}
