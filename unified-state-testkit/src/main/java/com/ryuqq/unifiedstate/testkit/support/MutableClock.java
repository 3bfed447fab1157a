package com.ryuqq.unifiedstate.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 시간을 진행시킬 수 있는 Clock.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * 현재 시각을 주어진 만큼 진행.
     */
    public synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }

    /**
     * 현재 시각 설정.
     */
    public void set(Instant instant) {
        now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
