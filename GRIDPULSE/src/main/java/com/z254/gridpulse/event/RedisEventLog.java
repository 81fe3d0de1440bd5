package com.z254.gridpulse.event;

import com.z254.gridpulse.config.GridPulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Redis Streams-based event log.
 * Entry ids are {@code <seq>-0}, so a replay from a sequence number is a single XRANGE.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.storage", name = "type", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisEventLog implements EventLog {

    private static final String FIELD_SEQ = "seq";
    private static final String FIELD_EVENT = "event";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final GridPulseProperties.EventProperties config;

    public RedisEventLog(ReactiveRedisTemplate<String, String> redisTemplate, GridPulseProperties properties) {
        this.redisTemplate = redisTemplate;
        this.config = properties.getEvents();
    }

    @Override
    public Mono<Long> nextSequence(String taskId) {
        String key = sequenceKey(taskId);
        return redisTemplate.opsForValue()
                .increment(key)
                .flatMap(seq -> redisTemplate.expire(key, config.getTtl()).thenReturn(seq));
    }

    @Override
    public Mono<Void> append(String taskId, long seq, String json) {
        String streamKey = streamKey(taskId);

        MapRecord<String, String, String> record = StreamRecords.newRecord()
                .in(streamKey)
                .withId(RecordId.of(seq, 0))
                .ofMap(Map.of(FIELD_SEQ, String.valueOf(seq), FIELD_EVENT, json));

        return redisTemplate.opsForStream()
                .add(record)
                .then(redisTemplate.opsForStream().trim(streamKey, config.getMaxLogLength(), true))
                .then(redisTemplate.expire(streamKey, config.getTtl()))
                .doOnSuccess(ignored -> log.trace("Appended event {} to {}", seq, streamKey))
                .then();
    }

    @Override
    public Flux<String> read(String taskId, long fromSeq) {
        long from = Math.max(fromSeq, 1);
        return redisTemplate.opsForStream()
                .range(streamKey(taskId), Range.rightUnbounded(Range.Bound.inclusive(from + "-0")))
                .map(record -> (String) record.getValue().get(FIELD_EVENT));
    }

    private String streamKey(String taskId) {
        return config.getRedisKeyPrefix() + taskId;
    }

    private String sequenceKey(String taskId) {
        return config.getRedisKeyPrefix() + taskId + ":seq";
    }
}
