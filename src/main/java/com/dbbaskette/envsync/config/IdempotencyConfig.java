package com.dbbaskette.envsync.config;

import com.dbbaskette.envsync.repository.IdempotencyRecordRepository;
import com.dbbaskette.envsync.service.idempotency.IdempotencyGate;
import com.dbbaskette.envsync.service.idempotency.IdempotencyStore;
import com.dbbaskette.envsync.service.idempotency.InMemoryIdempotencyStore;
import com.dbbaskette.envsync.service.idempotency.JpaIdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class IdempotencyConfig {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyConfig.class);

    @Bean
    public IdempotencyStore idempotencyStore(EnvSyncProperties properties, IdempotencyRecordRepository repository,
                                             Clock clock) {
        if ("memory".equalsIgnoreCase(properties.getIdempotency().getStore())) {
            log.info("Using in-memory idempotency store");
            return new InMemoryIdempotencyStore(clock);
        }
        return new JpaIdempotencyStore(repository, clock);
    }

    @Bean
    public IdempotencyGate idempotencyGate(IdempotencyStore idempotencyStore, EnvSyncProperties properties) {
        return new IdempotencyGate(idempotencyStore, properties.getIdempotency().isStrictChecksum());
    }
}
