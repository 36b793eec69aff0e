package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationCooldownTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final EscalationCooldown cooldown = new EscalationCooldown(Duration.ofSeconds(10), clock);

    @Test
    void allowsOneEscalationPerPeriod() {
        assertThat(cooldown.tryAcquire("s1")).isTrue();
        clock.advance(Duration.ofSeconds(9));
        assertThat(cooldown.tryAcquire("s1")).isFalse();
        clock.advance(Duration.ofSeconds(1));
        assertThat(cooldown.tryAcquire("s1")).isTrue();
    }

    @Test
    void sessionsAreIndependent() {
        assertThat(cooldown.tryAcquire("s1")).isTrue();
        assertThat(cooldown.tryAcquire("s2")).isTrue();
        assertThat(cooldown.tryAcquire("s1")).isFalse();
    }

    @Test
    void forgetRestartsTheSession() {
        cooldown.tryAcquire("s1");
        cooldown.forget("s1");
        assertThat(cooldown.tryAcquire("s1")).isTrue();
    }
}
