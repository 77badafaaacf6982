package com.neorag.config;

import com.neorag.repository.RedisSemanticCacheStore;
import com.neorag.repository.SemanticCacheStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis configuration for the semantic cache store.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "neorag.cache", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisConfiguration {

    /**
     * Lettuce connection factory with timeouts and reconnects.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(NeoragProperties properties) {
        NeoragProperties.RedisConfig redis = properties.getRedis();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        server.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null && !redis.getPassword().isEmpty()) {
            server.setPassword(RedisPassword.of(redis.getPassword()));
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(10))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(redis.getTimeout()))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(redis.getTimeout())
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, clientConfig);

        log.info("Configured Redis connection factory for {}:{} db={}",
                redis.getHost(), redis.getPort(), redis.getDatabase());
        return factory;
    }

    /**
     * Template for raw byte values (embeddings, questions, answer payloads).
     */
    @Bean
    public RedisTemplate<String, byte[]> cacheBytesTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }

    /**
     * Template for the sorted-set index and the counter hash.
     */
    @Bean
    public StringRedisTemplate cacheStringTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public SemanticCacheStore semanticCacheStore(RedisTemplate<String, byte[]> cacheBytesTemplate,
                                                 StringRedisTemplate cacheStringTemplate) {
        log.info("Semantic cache backend: redis");
        return new RedisSemanticCacheStore(cacheBytesTemplate, cacheStringTemplate);
    }
}
