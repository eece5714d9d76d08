package com.runway.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.bridge.CallbackBridgeRegistry;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.remote.RemoteStore;
import com.runway.core.resources.TempResourceManager;
import com.runway.executor.agent.AgentStreamClient;
import com.runway.executor.agent.AgentStreamParser;
import com.runway.executor.agent.CliAgentStreamClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Worker pool for stream draining and orchestration steps. Threads are daemons
     * so a stuck child process never keeps the JVM alive.
     *
     * <p>The pool has no upper limit: a drain task queued behind busy threads would
     * leave its process blocked on a full pipe. Concurrency is bounded upstream, one
     * running command per active session.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runwayExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runway-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new LocalProcessLauncher();
    }

    @Bean
    public AgentStreamClient agentStreamClient(ExecutionProperties properties, ProcessLauncher launcher,
                                               ObjectMapper objectMapper, ExecutorService runwayExecutor) {
        return new CliAgentStreamClient(properties.getAgentCommand(), launcher,
                new AgentStreamParser(objectMapper), runwayExecutor);
    }

    @Bean
    public ExecutorRegistry executorRegistry(ProcessLauncher launcher, TempResourceManager resources,
                                             CallbackBridgeRegistry bridges, RemoteStore remoteStore,
                                             AgentStreamClient agentStreamClient, ObjectMapper objectMapper,
                                             ExecutionProperties properties, RunwayMetrics metrics,
                                             ExecutorService runwayExecutor) {
        return new ExecutorRegistry(List.of(
                new InteractiveShellExecutor(launcher, resources, properties, metrics),
                new InteractiveAgentExecutor(launcher, resources, bridges, objectMapper, properties, metrics),
                new BackgroundShellExecutor(launcher, resources, properties, metrics, runwayExecutor),
                new BackgroundAgentExecutor(agentStreamClient, remoteStore, resources, properties, metrics)));
    }
}
