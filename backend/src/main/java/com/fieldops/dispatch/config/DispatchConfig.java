package com.fieldops.dispatch.config;

import com.fieldops.dispatch.scheduler.DispatchProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DispatchConfig {
  public static final String CANDIDATE_EXECUTOR = "candidateExecutor";

  @Bean
  Clock clock(DispatchProperties properties) {
    return Clock.system(ZoneId.of(properties.getZone()));
  }

  @Bean(name = CANDIDATE_EXECUTOR, destroyMethod = "shutdown")
  @Qualifier(CANDIDATE_EXECUTOR)
  ExecutorService candidateExecutor(DispatchProperties properties) {
    AtomicInteger seq = new AtomicInteger();
    ThreadFactory factory = r -> {
      Thread t = new Thread(r, "candidate-eval-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newFixedThreadPool(properties.getCandidatePoolSize(), factory);
  }
}
