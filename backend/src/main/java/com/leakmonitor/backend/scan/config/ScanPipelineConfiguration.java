package com.leakmonitor.backend.scan.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
public class ScanPipelineConfiguration {

  /** One worker: scan runs and recovery operations never overlap. */
  @Bean(name = "scanPipelineExecutor", destroyMethod = "shutdown")
  public ExecutorService scanPipelineExecutor() {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("scan-pipeline-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    return Executors.newSingleThreadExecutor(threadFactory);
  }
}
