/**
 * Redis configuration for shared coordination state
 *
 * Features:
 * - Supports connection via REDIS_URL or individual host/port properties
 * - Parses credentials and TLS scheme from Redis URL strings
 * - Masks credentials in logs
 * - Exposes the store abstraction used by quota, rate-limit, job status and queue code
 */
package net.bookharvest.config;

import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.support.kv.RedisKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;

import java.net.URI;

@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);
    private static final int DEFAULT_REDIS_PORT = 6379;

    /**
     * Provides a pooled Jedis client. REDIS_URL wins over the individual properties.
     *
     * @throws IllegalStateException if REDIS_URL is set but malformed
     */
    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled(@Value("${app.redis.url:}") String redisUrl,
                                   @Value("${app.redis.host:localhost}") String redisHost,
                                   @Value("${app.redis.port:6379}") int redisPort,
                                   @Value("${app.redis.password:}") String redisPassword,
                                   @Value("${app.redis.ssl:false}") boolean useSsl,
                                   @Value("${app.redis.timeout-ms:2000}") int timeoutMillis) {
        String host = redisHost;
        int port = redisPort > 0 ? redisPort : DEFAULT_REDIS_PORT;
        String password = redisPassword;
        boolean ssl = useSsl;

        if (StringUtils.hasText(redisUrl)) {
            String urlToLog = redisUrl.replaceAll("redis(s)?://[^@]*@", "redis$1://****@");
            try {
                URI uri = URI.create(redisUrl.trim());
                if (uri.getHost() == null) {
                    throw new IllegalArgumentException("missing host");
                }
                host = uri.getHost();
                port = uri.getPort() == -1 ? DEFAULT_REDIS_PORT : uri.getPort();
                ssl = "rediss".equalsIgnoreCase(uri.getScheme());
                if (uri.getUserInfo() != null) {
                    String userInfo = uri.getUserInfo();
                    int colonIdx = userInfo.indexOf(':');
                    password = colonIdx != -1 ? userInfo.substring(colonIdx + 1) : userInfo;
                }
                log.info("[REDIS] Using REDIS_URL {} (host={}, port={}, ssl={})", urlToLog, host, port, ssl);
            } catch (IllegalArgumentException e) {
                log.error("[REDIS] Invalid REDIS_URL format: {}", urlToLog, e);
                throw new IllegalStateException("Invalid REDIS_URL: " + urlToLog, e);
            }
        } else {
            log.info("[REDIS] Connecting using host/port properties {}:{} (ssl={}, timeout={}ms)", host, port, ssl, timeoutMillis);
        }

        DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
            .ssl(ssl)
            .connectionTimeoutMillis(timeoutMillis)
            .socketTimeoutMillis(timeoutMillis);
        if (StringUtils.hasText(password)) {
            clientConfigBuilder.password(password);
        }
        JedisClientConfig clientConfig = clientConfigBuilder.build();
        return new JedisPooled(new HostAndPort(host, port), clientConfig);
    }

    @Bean
    public KeyValueStore keyValueStore(JedisPooled jedisPooled) {
        return new RedisKeyValueStore(jedisPooled);
    }
}
