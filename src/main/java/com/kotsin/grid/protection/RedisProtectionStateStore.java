package com.kotsin.grid.protection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.grid.config.GridProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "grid.protection.store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisProtectionStateStore implements ProtectionStateStore {

    private final RedisTemplate<String, String> gridStringRedisTemplate;
    private final String key;
    private final ObjectMapper mapper = ProtectionStateJson.mapper();

    public RedisProtectionStateStore(RedisTemplate<String, String> gridStringRedisTemplate, GridProps props) {
        this.gridStringRedisTemplate = gridStringRedisTemplate;
        this.key = "grid:protection:" + props.symbol();
    }

    @Override
    public Optional<ProtectionState> load() {
        try {
            String raw = gridStringRedisTemplate.opsForValue().get(key);
            return raw == null ? Optional.empty() : Optional.of(mapper.readValue(raw, ProtectionState.class));
        } catch (Exception e) {
            log.error("PROTECTION_STATE_LOAD_FAILED key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(ProtectionState state) {
        try {
            gridStringRedisTemplate.opsForValue().set(key, mapper.writeValueAsString(state));
        } catch (Exception e) {
            log.error("PROTECTION_STATE_SAVE_FAILED key={} error={}", key, e.getMessage());
        }
    }
}
