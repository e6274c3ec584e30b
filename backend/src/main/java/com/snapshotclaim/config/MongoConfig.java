package com.snapshotclaim.config;

import com.snapshotclaim.domain.Claim;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.Decimal128;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.index.Index;

import java.math.BigDecimal;
import java.util.List;

/**
 * MongoDB configuration: Decimal128 reading for aggregated balance totals, and the unique source-address index
 * that is the only enforcement point for one claim per source address.
 */
@Configuration
@Slf4j
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(Decimal128Reader.INSTANCE));
    }

    /** Ensures the unique index even when spring.data.mongodb.auto-index-creation is off. */
    @Bean
    public ApplicationRunner claimIndexInitializer(MongoTemplate mongoTemplate) {
        return args -> {
            String name = mongoTemplate.indexOps(Claim.class).ensureIndex(new Index()
                    .on(Claim.SOURCE_ADDRESS_FIELD, Sort.Direction.ASC)
                    .unique()
                    .named(Claim.SOURCE_ADDRESS_INDEX));
            log.info("Claim index {} ensured", name);
        };
    }

    /** Balance totals come back from $sum over $toDecimal as Decimal128. */
    @ReadingConverter
    enum Decimal128Reader implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            if (source.isNaN() || source.isInfinite()) {
                throw new IllegalStateException("Non-finite Decimal128 balance total: " + source);
            }
            return source.bigDecimalValue();
        }
    }
}
