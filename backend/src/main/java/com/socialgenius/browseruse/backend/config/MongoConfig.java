package com.socialgenius.browseruse.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

@Configuration
public class MongoConfig {

    /** Stands in for '.' inside map keys; web storage keys often contain dots. */
    static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoDatabaseFactory mongoDbFactory,
            MongoMappingContext mappingContext,
            MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(
                new DefaultDbRefResolver(mongoDbFactory), mappingContext);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
