package org.miniworker.manager;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessInfoTest {

    @Test
    void splitsTheCommandLineOnWhitespace() {
        ProcessInfo info = new ProcessInfo(1L, "  java  -cp a.jar\torg.miniworker.Main run ", null);

        assertThat(info.arguments()).containsExactly("java", "-cp", "a.jar", "org.miniworker.Main", "run");
        assertThat(info.startEpochSeconds()).isNull();
    }

    @Test
    void missingCommandLineHasNoArguments() {
        ProcessInfo info = new ProcessInfo(1L, null, Instant.ofEpochMilli(1_500L));

        assertThat(info.commandLine()).isEmpty();
        assertThat(info.arguments()).isEmpty();
        assertThat(info.startEpochSeconds()).isEqualTo(1.5);
    }
}
