package com.tally.service.core.retention;

import com.tally.service.core.config.TallyProperties;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HistoryService {

    static final String TEXT_CONTENT_TYPE = "text/plain";

    private final RetentionEnforcer retentionEnforcer;
    private final HistoryRepository repository;
    private final TallyProperties properties;
    private final Clock clock;

    public InsertOutcome recordPresence(long subjectId, PresenceStatus status, Instant at) {
        PresenceStatus effective = status != null ? status : PresenceStatus.OFFLINE;
        return retentionEnforcer.onInsert(subjectId, text(HistoryLogType.PRESENCE, effective.wireValue(), at));
    }

    public InsertOutcome recordAvatar(long subjectId, String mimeFormat, byte[] avatar, Instant at) {
        if (avatar == null || avatar.length == 0) {
            throw new IllegalArgumentException("Avatar bytes are required");
        }
        if (mimeFormat == null || mimeFormat.isBlank()) {
            throw new IllegalArgumentException("Avatar mime format is required");
        }
        return retentionEnforcer.onInsert(
                subjectId, new HistoryEntry(HistoryLogType.AVATAR, avatar, mimeFormat, orNow(at)));
    }

    public InsertOutcome recordName(long subjectId, String name, Instant at) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name is required");
        }
        return retentionEnforcer.onInsert(subjectId, text(HistoryLogType.NAME, name, at));
    }

    public List<StoredHistoryEntry> history(long subjectId, HistoryLogType logType) {
        return repository.list(subjectId, logType, properties.getRetention().getTieBreak());
    }

    private HistoryEntry text(HistoryLogType logType, String value, Instant at) {
        return new HistoryEntry(logType, value.getBytes(StandardCharsets.UTF_8), TEXT_CONTENT_TYPE, orNow(at));
    }

    private Instant orNow(Instant at) {
        return at != null ? at : Instant.now(clock);
    }
}
