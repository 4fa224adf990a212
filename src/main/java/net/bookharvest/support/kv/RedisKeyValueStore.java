package net.bookharvest.support.kv;

import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} backed by a pooled Jedis client.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final JedisPooled jedis;

    public RedisKeyValueStore(JedisPooled jedis) {
        this.jedis = Objects.requireNonNull(jedis, "jedis");
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(jedis.get(key)));
    }

    @Override
    public void set(String key, String value) {
        call("SET " + key, () -> jedis.set(key, value));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        long seconds = Math.max(1L, ttl.toSeconds());
        call("SETEX " + key, () -> jedis.setex(key, seconds, value));
    }

    @Override
    public long incrementBy(String key, long delta) {
        return call("INCRBY " + key, () -> jedis.incrBy(key, delta));
    }

    @Override
    public boolean delete(String key) {
        return call("DEL " + key, () -> jedis.del(key) > 0);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        long seconds = Math.max(1L, ttl.toSeconds());
        return call("EXPIRE " + key, () -> jedis.expire(key, seconds) == 1L);
    }

    @Override
    public long pushTail(String key, List<String> values) {
        if (values.isEmpty()) {
            return listLength(key);
        }
        return call("RPUSH " + key, () -> jedis.rpush(key, values.toArray(String[]::new)));
    }

    @Override
    public List<String> popHead(String key, int count) {
        return call("LPOP " + key, () -> {
            List<String> popped = jedis.lpop(key, count);
            return popped != null ? popped : List.of();
        });
    }

    @Override
    public long listLength(String key) {
        return call("LLEN " + key, () -> jedis.llen(key));
    }

    private <T> T call(String operation, Supplier<T> jedisCall) {
        try {
            return jedisCall.get();
        } catch (JedisException e) {
            throw new KeyValueStoreException(operation, e);
        }
    }
}
