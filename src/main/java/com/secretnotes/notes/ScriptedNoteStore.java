package com.secretnotes.notes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretnotes.core.ConsumedNote;
import com.secretnotes.core.NoteConfig;
import com.secretnotes.core.NoteRequest;
import com.secretnotes.core.NoteStore;
import com.secretnotes.exception.InvalidMetaException;
import com.secretnotes.exception.InvalidPolicyException;
import com.secretnotes.exception.NoteNotFoundException;
import com.secretnotes.exception.PayloadTooLargeException;
import com.secretnotes.storage.KeyValueStorage;
import com.secretnotes.storage.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Note store on top of a key-value store with server-side scripting.
 *
 * Two consumption policies:
 * - view-limited: a counter in the record, decremented on every consume,
 *   key deleted when it runs out
 * - time-limited: a TTL on the key, record never touched on read
 *
 * When both are requested the counter drives deletion and the expiry is
 * still attached to the key as an upper bound on its lifetime.
 *
 * Consume runs as a single Lua script so that two readers racing for the
 * last view cannot both win. The rewrite uses KEEPTTL (Redis >= 6.0) so
 * decrementing never resets or clears the key's expiry.
 */
@Slf4j
public class ScriptedNoteStore implements NoteStore {

    static final String KEY_PREFIX = "note:";

    // Returns the record after mutation (views = 0 when it was deleted), or nil if absent
    static final String CONSUME_SCRIPT =
            "local key = KEYS[1]\n" +
            "local raw = redis.call('GET', key)\n" +
            "if not raw then\n" +
            "  return nil\n" +
            "end\n" +
            "local data = cjson.decode(raw)\n" +
            "local views = data.views\n" +
            "if views ~= nil and views ~= cjson.null then\n" +
            "  if views <= 1 then\n" +
            "    redis.call('DEL', key)\n" +
            "    data.views = 0\n" +
            "  else\n" +
            "    data.views = views - 1\n" +
            "    redis.call('SET', key, cjson.encode(data), 'KEEPTTL')\n" +
            "  end\n" +
            "end\n" +
            "return cjson.encode(data)";

    private final KeyValueStorage storage;
    private final NoteConfig config;
    private final NoteIdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Counter createdNotes;
    private final Counter previewedNotes;
    private final Counter consumedNotes;
    private final Counter notFound;

    public ScriptedNoteStore(
            KeyValueStorage storage,
            NoteConfig config,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        this(storage, config, new NoteIdGenerator(config.getIdLength()), objectMapper, clock, meterRegistry);
    }

    ScriptedNoteStore(
            KeyValueStorage storage,
            NoteConfig config,
            NoteIdGenerator idGenerator,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {

        config.validate();
        this.storage = storage;
        this.config = config;
        this.idGenerator = idGenerator;
        this.objectMapper = objectMapper;
        this.clock = clock;

        this.createdNotes = Counter.builder("notes.created")
                .description("Number of notes created")
                .register(meterRegistry);

        this.previewedNotes = Counter.builder("notes.previewed")
                .description("Number of successful previews")
                .register(meterRegistry);

        this.consumedNotes = Counter.builder("notes.consumed")
                .description("Number of successful consuming reads")
                .register(meterRegistry);

        this.notFound = Counter.builder("notes.not_found")
                .description("Preview or consume attempts on absent notes")
                .register(meterRegistry);
    }

    @Override
    public String create(NoteRequest request) {
        if (request.getContents() == null || request.getMeta() == null) {
            throw new IllegalArgumentException("contents and meta are required");
        }
        if (utf8Length(request.getContents()) > config.getSizeLimitBytes()) {
            throw new PayloadTooLargeException(config.getSizeLimitBytes());
        }
        if (utf8Length(request.getMeta()) > config.getMetaLimitBytes()) {
            throw new InvalidMetaException(config.getMetaLimitBytes());
        }

        Integer views = request.getViews();
        Integer expiration = request.getExpirationMinutes();
        if (views == null && expiration == null) {
            throw new InvalidPolicyException("At least views or expiration must be set");
        }

        if (!config.isAllowAdvanced()) {
            views = 1;
            expiration = null;
        }

        Duration ttl = null;
        if (views != null) {
            if (views < 1 || views > config.getMaxViews()) {
                throw new InvalidPolicyException("Views must be between 1 and " + config.getMaxViews());
            }
            // views take priority; an in-range expiry only caps the key's lifetime
            if (expiration != null && isValidExpiration(expiration)) {
                ttl = Duration.ofMinutes(expiration);
            }
        } else {
            if (!isValidExpiration(expiration)) {
                throw new InvalidPolicyException(
                        "Expiration must be between 1 and " + config.getMaxExpirationMinutes() + " minutes");
            }
            ttl = Duration.ofMinutes(expiration);
        }

        NoteRecord record = NoteRecord.builder()
                .contents(request.getContents())
                .meta(request.getMeta())
                .views(views)
                .created(clock.instant().getEpochSecond())
                .build();

        String id = idGenerator.nextId();
        String payload = encode(record);
        if (ttl != null) {
            storage.set(keyFor(id), payload, ttl);
        } else {
            storage.set(keyFor(id), payload);
        }

        createdNotes.increment();
        log.debug("Stored note {}: views={}, ttl={}", id, views, ttl);
        return id;
    }

    @Override
    public String preview(String id) {
        String raw = storage.get(keyFor(id));
        if (raw == null) {
            notFound.increment();
            throw new NoteNotFoundException();
        }
        previewedNotes.increment();
        return decode(raw).getMeta();
    }

    @Override
    public ConsumedNote consume(String id) {
        List<String> keys = Collections.singletonList(keyFor(id));
        Object result = storage.evalScript(CONSUME_SCRIPT, keys, Collections.emptyList());

        if (result == null) {
            notFound.increment();
            throw new NoteNotFoundException();
        }

        NoteRecord record = decode(result.toString());
        consumedNotes.increment();
        return new ConsumedNote(record.getContents(), record.getMeta(), record.getViews());
    }

    private boolean isValidExpiration(Integer minutes) {
        return minutes != null && minutes >= 1 && minutes <= config.getMaxExpirationMinutes();
    }

    static String keyFor(String id) {
        return KEY_PREFIX + id;
    }

    private static long utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    private String encode(NoteRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize note record", e);
        }
    }

    private NoteRecord decode(String raw) {
        try {
            return objectMapper.readValue(raw, NoteRecord.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unreadable note record", e);
        }
    }
}
