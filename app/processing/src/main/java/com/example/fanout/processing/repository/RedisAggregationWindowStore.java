/*
 * どこで: Processing の集約ストア (Redis)
 * 何を: ソート済みセット + メタハッシュでウィンドウを保持し、追加/フラッシュを Lua で原子的に行う
 * なぜ: 全ティアの複数ワーカーが同じウィンドウを同時に触っても重複送信や取りこぼしを起こさないため
 */
package com.example.fanout.processing.repository;

import com.example.fanout.common.event.NotificationEvent;
import com.example.fanout.common.event.NotificationEventCodec;
import com.example.fanout.processing.config.AggregationProperties;
import com.example.fanout.processing.model.AggregationKey;
import com.example.fanout.processing.model.WindowSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RedisAggregationWindowStore implements AggregationWindowStore {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private static final String ENCODE_FUNCTION =
      """
      local function encode(list)
        if #list == 0 then
          return '[]'
        end
        return cjson.encode(list)
      end
      """;

  // KEYS[1]=window, KEYS[2]=meta
  // ARGV: actorId, firstEventJson, actorName, actorAvatar, ttlSeconds
  // スコアはウィンドウ内の到着連番。同一ミリ秒の到着でも順序が崩れない
  private static final String ADD_SCRIPT =
      ENCODE_FUNCTION
          + """
          if not redis.call('ZSCORE', KEYS[1], ARGV[1]) then
            local seq = redis.call('HINCRBY', KEYS[2], 'seq', 1)
            redis.call('ZADD', KEYS[1], 'NX', seq, ARGV[1])
          end
          local created = redis.call('HSETNX', KEYS[2], 'first_event', ARGV[2])
          if created == 1 then
            local name = ARGV[3]
            if name == '' then
              name = ARGV[1]
            end
            redis.call('HSET', KEYS[2], 'actor_names', encode({name}), 'actor_avatars', encode({ARGV[4]}))
          elseif ARGV[3] ~= '' then
            local names = cjson.decode(redis.call('HGET', KEYS[2], 'actor_names') or '[]')
            local known = false
            for _, existing in ipairs(names) do
              if existing == ARGV[3] then
                known = true
                break
              end
            end
            if not known then
              -- actor_avatars は actor_names と同じ添字で対応させる (アバター無しは '')
              local avatars = cjson.decode(redis.call('HGET', KEYS[2], 'actor_avatars') or '[]')
              names[#names + 1] = ARGV[3]
              avatars[#names] = ARGV[4]
              redis.call('HSET', KEYS[2], 'actor_names', encode(names), 'actor_avatars', encode(avatars))
            end
          end
          redis.call('EXPIRE', KEYS[1], ARGV[5])
          redis.call('EXPIRE', KEYS[2], ARGV[5])
          return redis.call('ZCARD', KEYS[1])
          """;

  // KEYS[1]=window, KEYS[2]=meta
  // ARGV: firstEventJson, namesJson, avatarsJson, ttlSeconds, actor1, actor2, ...
  // 戻したアクターは負のスコアで先頭に並べ、その間に到着したアクターは後ろに残す
  private static final String RESTORE_SCRIPT =
      ENCODE_FUNCTION
          + """
          local restored = #ARGV - 4
          for i = 5, #ARGV do
            redis.call('ZADD', KEYS[1], 'LT', i - 5 - restored, ARGV[i])
          end
          local names = cjson.decode(ARGV[2])
          local avatars = cjson.decode(ARGV[3])
          for i = #avatars + 1, #names do
            avatars[i] = ''
          end
          local current_names = cjson.decode(redis.call('HGET', KEYS[2], 'actor_names') or '[]')
          local current_avatars = cjson.decode(redis.call('HGET', KEYS[2], 'actor_avatars') or '[]')
          for i, name in ipairs(current_names) do
            local known = false
            for _, existing in ipairs(names) do
              if existing == name then
                known = true
                break
              end
            end
            if not known then
              names[#names + 1] = name
              avatars[#names] = current_avatars[i] or ''
            end
          end
          redis.call('HSET', KEYS[2], 'first_event', ARGV[1], 'actor_names', encode(names), 'actor_avatars', encode(avatars))
          redis.call('EXPIRE', KEYS[1], ARGV[4])
          redis.call('EXPIRE', KEYS[2], ARGV[4])
          return redis.call('ZCARD', KEYS[1])
          """;

  // 戻り値: {} または {first_event, actor_names, actor_avatars, actor1, actor2, ...}
  private static final String FLUSH_SCRIPT =
      """
      local actors = redis.call('ZRANGE', KEYS[1], 0, -1)
      if #actors == 0 then
        redis.call('DEL', KEYS[2])
        return {}
      end
      local meta = redis.call('HMGET', KEYS[2], 'first_event', 'actor_names', 'actor_avatars')
      redis.call('DEL', KEYS[1], KEYS[2])
      local result = {meta[1] or '', meta[2] or '[]', meta[3] or '[]'}
      for _, actor in ipairs(actors) do
        result[#result + 1] = actor
      end
      return result
      """;

  private static final int FLUSH_HEADER_SIZE = 3;

  private final StringRedisTemplate redisTemplate;
  private final NotificationEventCodec codec;
  private final ObjectMapper objectMapper;
  private final AggregationProperties properties;
  private final RedisScript<Long> addScript = new DefaultRedisScript<>(ADD_SCRIPT, Long.class);
  private final RedisScript<Long> restoreScript =
      new DefaultRedisScript<>(RESTORE_SCRIPT, Long.class);

  @SuppressWarnings("rawtypes")
  private final RedisScript<List> flushScript = new DefaultRedisScript<>(FLUSH_SCRIPT, List.class);

  public RedisAggregationWindowStore(
      StringRedisTemplate redisTemplate,
      NotificationEventCodec codec,
      ObjectMapper objectMapper,
      AggregationProperties properties) {
    this.redisTemplate = redisTemplate;
    this.codec = codec;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public long addActor(AggregationKey key, NotificationEvent event) {
    Long count =
        redisTemplate.execute(
            addScript,
            List.of(key.windowKey(), key.metaKey()),
            event.actorId(),
            codec.encode(event),
            nullToEmpty(event.actorName()),
            nullToEmpty(event.actorAvatar()),
            Long.toString(properties.windowTtl().toSeconds()));
    if (count == null) {
      throw new IllegalStateException("aggregation add script returned null key=" + key.windowKey());
    }
    return count;
  }

  @Override
  public Optional<WindowSnapshot> flush(String windowKey) {
    List<?> raw =
        redisTemplate.execute(
            flushScript, List.of(windowKey, AggregationKey.metaKeyOf(windowKey)));
    if (raw == null || raw.size() <= FLUSH_HEADER_SIZE) {
      return Optional.empty();
    }
    String firstEventJson = stringValue(raw.get(0));
    if (firstEventJson.isEmpty()) {
      // メタだけ先に失効したウィンドウは元イベントを復元できない
      throw new IllegalStateException("aggregation window has no first event key=" + windowKey);
    }
    List<String> actorIds = new ArrayList<>(raw.size() - FLUSH_HEADER_SIZE);
    for (int i = FLUSH_HEADER_SIZE; i < raw.size(); i++) {
      actorIds.add(stringValue(raw.get(i)));
    }
    return Optional.of(
        new WindowSnapshot(
            actorIds,
            parseList(stringValue(raw.get(1))),
            parseList(stringValue(raw.get(2))),
            codec.decode(firstEventJson)));
  }

  @Override
  public void restore(String windowKey, WindowSnapshot snapshot) {
    List<String> args = new ArrayList<>(snapshot.actorIds().size() + 4);
    args.add(codec.encode(snapshot.firstEvent()));
    args.add(toJson(snapshot.actorNames()));
    args.add(toJson(snapshot.actorAvatars()));
    args.add(Long.toString(properties.windowTtl().toSeconds()));
    args.addAll(snapshot.actorIds());
    Long count =
        redisTemplate.execute(
            restoreScript,
            List.of(windowKey, AggregationKey.metaKeyOf(windowKey)),
            args.toArray());
    if (count == null) {
      throw new IllegalStateException("aggregation restore script returned null key=" + windowKey);
    }
  }

  @Override
  public List<String> findWindowKeys(long windowId) {
    ScanOptions options =
        ScanOptions.scanOptions()
            .match(AggregationKey.windowPattern(windowId))
            .count(properties.scanCount())
            .build();
    List<String> keys = new ArrayList<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      cursor.forEachRemaining(keys::add);
    }
    return keys;
  }

  private List<String> parseList(String json) {
    if (json.isEmpty()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("aggregation metadata is not a JSON array", ex);
    }
  }

  private String toJson(List<String> values) {
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("aggregation metadata could not be serialized", ex);
    }
  }

  private static String stringValue(Object value) {
    return value == null ? "" : String.valueOf(value);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
