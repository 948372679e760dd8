package org.miniworker.manager;

import org.junit.jupiter.api.Test;
import org.miniworker.utils.SystemInfo;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SystemProcessTableTest {

    private final SystemProcessTable table = new SystemProcessTable();

    @Test
    void seesTheCurrentJvm() {
        long self = SystemInfo.currentPid();

        assertThat(table.isAlive(self)).isTrue();
        assertThat(table.find(self)).hasValueSatisfying(info -> assertThat(info.pid()).isEqualTo(self));
        assertThat(table.snapshot()).extracting(ProcessInfo::pid).contains(self);
    }

    @Test
    void unknownPidsAreNotAliveAndAlreadyGone() throws InterruptedException {
        long unused = Long.MAX_VALUE - 7;

        assertThat(table.isAlive(unused)).isFalse();
        assertThat(table.find(unused)).isEmpty();
        assertThat(table.requestTermination(unused)).isFalse();
        assertThat(table.awaitExit(unused, Duration.ofMillis(10))).isTrue();
    }
}
