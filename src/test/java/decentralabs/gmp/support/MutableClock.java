package decentralabs.gmp.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock the tests can move forward to cross expiry boundaries.
 */
public class MutableClock extends Clock {

    private Instant now;

    public MutableClock(long epochSecond) {
        this.now = Instant.ofEpochSecond(epochSecond);
    }

    public void advanceSeconds(long seconds) {
        now = now.plus(Duration.ofSeconds(seconds));
    }

    public void setEpochSecond(long epochSecond) {
        now = Instant.ofEpochSecond(epochSecond);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
