package com.eainde.slopstopper.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = MdcAwareExecutor.fixed(1, "mdc-test-");

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    @Test
    void shouldCarrySubmitterMdcOntoWorker() throws Exception {
        MDC.put("videoId", "aaaaaaaaaaa");

        String seen = executor.submit(() -> MDC.get("videoId")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("aaaaaaaaaaa");
    }

    @Test
    void shouldNotLeakMdcBetweenTasks() throws Exception {
        MDC.put("videoId", "aaaaaaaaaaa");
        executor.submit(() -> MDC.get("videoId")).get(5, TimeUnit.SECONDS);
        MDC.clear();

        String seen = executor.submit(() -> MDC.get("videoId")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    void shouldUseNamedDaemonThreads() throws Exception {
        Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("mdc-test-");
        assertThat(worker.isDaemon()).isTrue();
    }
}
