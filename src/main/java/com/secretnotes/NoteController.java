package com.secretnotes;

import com.secretnotes.core.ActionClass;
import com.secretnotes.core.ConsumedNote;
import com.secretnotes.core.NoteConfig;
import com.secretnotes.core.NoteStore;
import com.secretnotes.core.RateLimiter;
import com.secretnotes.dto.CreateNoteRequest;
import com.secretnotes.exception.NoteNotFoundException;
import com.secretnotes.exception.RateLimitedException;
import com.secretnotes.storage.KeyValueStorage;
import com.secretnotes.storage.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Note API. Every note operation is gated by the rate limiter first;
 * preview and consume share the read budget.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class NoteController {

    private final NoteStore noteStore;
    private final RateLimiter rateLimiter;
    private final KeyValueStorage storage;
    private final ClientIdentityResolver identityResolver;
    private final NoteConfig noteConfig;

    @Value("${notes.version:3.0.0}")
    private String version;

    @Value("${notes.allow-files:true}")
    private boolean allowFiles;

    @Value("${theme.image:}")
    private String themeImage;

    @Value("${theme.text:}")
    private String themeText;

    @Value("${theme.page-title:Secret Notes}")
    private String themePageTitle;

    @Value("${theme.favicon:}")
    private String themeFavicon;

    @Value("${imprint.url:}")
    private String imprintUrl;

    @Value("${imprint.html:}")
    private String imprintHtml;

    public NoteController(
            NoteStore noteStore,
            RateLimiter rateLimiter,
            KeyValueStorage storage,
            ClientIdentityResolver identityResolver,
            NoteConfig noteConfig) {

        this.noteStore = noteStore;
        this.rateLimiter = rateLimiter;
        this.storage = storage;
        this.identityResolver = identityResolver;
        this.noteConfig = noteConfig;
    }

    @PostMapping("/notes")
    public ResponseEntity<Map<String, String>> createNote(
            @RequestBody CreateNoteRequest body,
            HttpServletRequest request) {

        String ip = admit(request, ActionClass.CREATE);

        String id = noteStore.create(body.toNoteRequest());

        log.info("action=create note_id={} ip={} views={} expiration={}",
                id, ip, body.getViews(), body.getExpiration());
        return ResponseEntity.ok(Map.of("id", id));
    }

    /**
     * Return note metadata without consuming a view
     */
    @GetMapping("/notes/{id}")
    public ResponseEntity<Map<String, String>> previewNote(
            @PathVariable String id,
            HttpServletRequest request) {

        String ip = admit(request, ActionClass.READ);

        String meta;
        try {
            meta = noteStore.preview(id);
        } catch (NoteNotFoundException e) {
            log.info("action=preview_not_found note_id={} ip={}", id, ip);
            throw e;
        }

        log.info("action=preview note_id={} ip={}", id, ip);
        return ResponseEntity.ok(Map.of("meta", meta));
    }

    /**
     * Consume (read and maybe destroy) a note
     */
    @DeleteMapping("/notes/{id}")
    public ResponseEntity<Map<String, String>> consumeNote(
            @PathVariable String id,
            HttpServletRequest request) {

        String ip = admit(request, ActionClass.READ);

        ConsumedNote note;
        try {
            note = noteStore.consume(id);
        } catch (NoteNotFoundException e) {
            log.info("action=consume_not_found note_id={} ip={}", id, ip);
            throw e;
        }

        Object remaining = note.getRemainingViews() != null ? note.getRemainingViews() : "time-based";
        log.info("action=consume note_id={} ip={} remaining_views={}", id, ip, remaining);

        Map<String, String> response = new LinkedHashMap<>();
        response.put("contents", note.getContents());
        response.put("meta", note.getMeta());
        return ResponseEntity.ok(response);
    }

    /**
     * Public limits and presentation settings for clients
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("version", version);
        status.put("max_size", noteConfig.getSizeLimitBytes());
        status.put("max_meta_size", noteConfig.getMetaLimitBytes());
        status.put("max_views", noteConfig.getMaxViews());
        status.put("max_expiration", noteConfig.getMaxExpirationMinutes());
        status.put("allow_advanced", noteConfig.isAllowAdvanced());
        status.put("allow_files", allowFiles);
        status.put("id_length", noteConfig.getIdLength());
        status.put("imprint_url", imprintUrl);
        status.put("imprint_html", imprintHtml);
        status.put("theme_image", themeImage);
        status.put("theme_text", themeText);
        status.put("theme_page_title", themePageTitle);
        status.put("theme_favicon", themeFavicon);
        return ResponseEntity.ok(status);
    }

    /**
     * End-to-end health check: a real write-then-read against Redis (not rate limited)
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Boolean>> live() {
        if (!storage.isAvailable()) {
            throw new StorageException("Redis unreachable");
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    private String admit(HttpServletRequest request, ActionClass action) {
        String ip = identityResolver.resolve(request);
        if (!rateLimiter.tryAcquire(ip, action)) {
            log.warn("action=rate_limit_{} ip={}", action.keyPart(), ip);
            throw new RateLimitedException(action);
        }
        return ip;
    }
}
