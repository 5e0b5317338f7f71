package com.my.keep.adapter.out.clock;

import com.my.keep.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 왜: Keep 동기화 요청의 clientTimestamp 를 UTC 기준으로 일관되게 만들기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(ZoneOffset.UTC);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
