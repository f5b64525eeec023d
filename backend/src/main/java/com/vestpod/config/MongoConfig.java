package com.vestpod.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * MongoDB configuration: prices and quantities are stored as Decimal128, never as double.
 * Indexes come from @Indexed / @CompoundIndex on the domain documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalWriter(),
                new BigDecimalReader()
        ));
    }

    /**
     * Values beyond 34 significant digits are rounded to fit Decimal128.
     */
    @WritingConverter
    static class BigDecimalWriter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source.round(MathContext.DECIMAL128));
        }
    }

    @ReadingConverter
    static class BigDecimalReader implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
