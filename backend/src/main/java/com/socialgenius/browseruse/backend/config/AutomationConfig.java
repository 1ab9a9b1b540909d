package com.socialgenius.browseruse.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import com.socialgenius.browseruse.backend.agent.RemoteBrowsingContext;
import com.socialgenius.browseruse.backend.service.OutcomeRuleTable;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(AutomationProperties.class)
public class AutomationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs submitted jobs detached from the HTTP request that created them.
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(AutomationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getTasks().getWorkerThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("auth-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Hosts the agent calls themselves. Unbounded because a call that outlives its
     * deadline is abandoned rather than interrupted and keeps its thread until it returns.
     */
    @Bean(name = "agentCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public HttpClient agentHttpClient(AutomationProperties properties) {
        // Force HTTP/1.1 - the sidecar's uvicorn server doesn't support HTTP/2 upgrade
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getAgent().getConnectTimeout())
                .build();
    }

    @Bean
    public BrowsingContext sharedBrowsingContext(HttpClient agentHttpClient, ObjectMapper objectMapper,
            AutomationProperties properties) {
        return new RemoteBrowsingContext(agentHttpClient, objectMapper,
                properties.getAgent().getUrl(), properties.getAgent().getContextId(),
                properties.getAgent().getRequestTimeout());
    }

    @Bean
    public OutcomeRuleTable outcomeRuleTable() {
        return OutcomeRuleTable.defaults();
    }
}
