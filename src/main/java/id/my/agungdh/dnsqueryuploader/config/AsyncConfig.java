package id.my.agungdh.dnsqueryuploader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Pool untuk upload batch. Jumlah request in-flight tetap dibatasi semaphore di BatchUploader,
     * pool ini cukup sebesar limit tsb.
     */
    @Bean(name = "uploadExecutor")
    public ThreadPoolTaskExecutor uploadExecutor(CollectorProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getConcurrency());
        ex.setMaxPoolSize(props.getConcurrency());
        ex.setThreadNamePrefix("dns-upload-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
