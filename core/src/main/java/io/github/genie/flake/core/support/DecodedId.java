package io.github.genie.flake.core.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class DecodedId {

    public static final String FID = "fid";
    public static final String MSB = "msb";
    public static final String TIME_BUCKET = "time_bucket";
    public static final String SEQ = "seq";
    public static final String GID = "gid";

    private final long fid;
    private final long msb;
    private final long timeBucket;
    private final long sequence;
    private final long generatorId;

    DecodedId(long fid, long msb, long timeBucket, long sequence, long generatorId) {
        this.fid = fid;
        this.msb = msb;
        this.timeBucket = timeBucket;
        this.sequence = sequence;
        this.generatorId = generatorId;
    }

    public long getFid() {
        return fid;
    }

    public long getMsb() {
        return msb;
    }

    public long getTimeBucket() {
        return timeBucket;
    }

    public long getSequence() {
        return sequence;
    }

    public long getGeneratorId() {
        return generatorId;
    }

    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        map.put(FID, fid);
        map.put(MSB, msb);
        map.put(TIME_BUCKET, timeBucket);
        map.put(SEQ, sequence);
        map.put(GID, generatorId);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedId)) return false;
        DecodedId that = (DecodedId) o;
        return fid == that.fid;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(fid);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
