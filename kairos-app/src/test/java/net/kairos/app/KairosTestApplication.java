package net.kairos.app;

import net.kairos.core.definition.JobDefinition;
import net.kairos.core.event.JobEvent;
import net.kairos.core.event.JobLifecycleListener;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Host application of the flow test: handlers and a listener declared as beans. */
@SpringBootApplication
public class KairosTestApplication {

    static final AtomicInteger SENT = new AtomicInteger();
    static final AtomicInteger HEARTBEATS = new AtomicInteger();
    static final List<JobEvent> EVENTS = new CopyOnWriteArrayList<>();

    @Bean
    JobDefinition sendMail() {
        return JobDefinition.of("send-mail", ctx -> SENT.incrementAndGet());
    }

    @Bean
    JobDefinition heartbeat() {
        return JobDefinition.of("heartbeat", ctx -> HEARTBEATS.incrementAndGet(),
                new JobDefinition.Options().concurrency(1).lockLifetime(Duration.ofMinutes(1)));
    }

    @Bean
    JobDefinition brokenExport() {
        return JobDefinition.of("broken-export", ctx -> { throw new IllegalStateException("no target bucket"); });
    }

    @Bean
    JobLifecycleListener recordingListener() {
        return EVENTS::add;
    }
}
