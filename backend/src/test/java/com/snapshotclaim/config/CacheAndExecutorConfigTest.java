package com.snapshotclaim.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.NOTIFICATION_EXECUTOR)
    Executor notificationExecutor;

    @Test
    @DisplayName("redistribution cache is created and usable")
    void redistributionCache() {
        Cache cache = cacheManager.getCache(CaffeineConfig.REDISTRIBUTION_CACHE);
        assertThat(cache).isNotNull();

        cache.put("current", "value");
        assertThat(cache.get("current").get()).isEqualTo("value");
        cache.clear();
        assertThat(cache.get("current")).isNull();
    }

    @Test
    @DisplayName("notification executor is a bounded pool")
    void notificationExecutor() {
        assertThat(notificationExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) notificationExecutor;
        assertThat(pool.getCorePoolSize()).isEqualTo(2);
        assertThat(pool.getMaxPoolSize()).isEqualTo(4);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("notify-");
    }
}
