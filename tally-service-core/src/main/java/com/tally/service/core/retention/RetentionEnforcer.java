package com.tally.service.core.retention;

import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.support.ConfigurationException;
import com.tally.service.core.support.StoreErrors;
import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Appends to a bounded history log and trims it back to its cap in the same transaction. Writers of
 * one (subject, log type) are serialised by a transaction-scoped lock, so no reader ever sees more
 * than {@code cap} entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionEnforcer {

    private final HistoryRepository repository;
    private final TransactionTemplate txTemplate;
    private final TallyProperties properties;

    @PostConstruct
    public void validateCaps() {
        for (HistoryLogType logType : HistoryLogType.values()) {
            int cap = properties.getRetention().capFor(logType);
            if (cap < 1) {
                throw new ConfigurationException("Retention cap for " + logType + " must be positive, was " + cap);
            }
        }
    }

    public InsertOutcome onInsert(long subjectId, HistoryEntry entry) {
        HistoryLogType logType = entry.logType();
        int cap = properties.getRetention().capFor(logType);
        TieBreakPolicy tieBreak = properties.getRetention().getTieBreak();
        try {
            return txTemplate.execute(status -> {
                repository.lockLog(subjectId, logType);
                if (logType.deduplicated() && sameAsLatest(subjectId, entry, tieBreak)) {
                    log.debug("Skipping duplicate {} entry for subject {}", logType, subjectId);
                    return InsertOutcome.duplicate();
                }
                long id = repository.insert(subjectId, entry);
                int trimmed = repository.trim(subjectId, logType, cap, tieBreak);
                if (trimmed > 0) {
                    log.debug("Trimmed {} {} entries for subject {} (cap {})", trimmed, logType, subjectId, cap);
                }
                return new InsertOutcome(true, id, trimmed);
            });
        } catch (RuntimeException ex) {
            throw StoreErrors.translate("History insert", ex);
        }
    }

    private boolean sameAsLatest(long subjectId, HistoryEntry entry, TieBreakPolicy tieBreak) {
        Optional<StoredHistoryEntry> latest = repository.findLatest(subjectId, entry.logType(), tieBreak);
        return latest.isPresent() && Arrays.equals(latest.get().value(), entry.value());
    }
}
