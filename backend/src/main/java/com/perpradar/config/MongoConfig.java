package com.perpradar.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.util.List;

/**
 * Position sizes and notional USD values are stored as Decimal128. Indexes come from the
 * {@code @Indexed}/{@code @CompoundIndex} annotations on the documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                BigDecimalToDecimal128.INSTANCE,
                Decimal128ToBigDecimal.INSTANCE
        ));
    }

    @WritingConverter
    enum BigDecimalToDecimal128 implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source);
        }
    }

    /** NaN and infinities have no BigDecimal form; they read as null, which positions treat as zero. */
    @ReadingConverter
    enum Decimal128ToBigDecimal implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            if (source.isNaN() || source.isInfinite()) {
                return null;
            }
            return source.bigDecimalValue();
        }
    }
}
