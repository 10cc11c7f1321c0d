package com.tally.service.core.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.support.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

class HistoryServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-01T12:00:00Z");

    private InMemoryHistoryRepository repository;
    private HistoryService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryHistoryRepository();
        TallyProperties properties = new TallyProperties();
        TransactionTemplate txTemplate = new TransactionTemplate(new PlatformTransactionManager() {
            @Override
            public TransactionStatus getTransaction(TransactionDefinition definition) {
                return new SimpleTransactionStatus();
            }

            @Override
            public void commit(TransactionStatus status) {}

            @Override
            public void rollback(TransactionStatus status) {}
        });
        RetentionEnforcer enforcer = new RetentionEnforcer(repository, txTemplate, properties);
        service = new HistoryService(enforcer, repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void presenceKeepsTheLastTwoTransitions() {
        service.recordPresence(1, PresenceStatus.ONLINE, NOW.minusSeconds(30));
        service.recordPresence(1, PresenceStatus.IDLE, NOW.minusSeconds(20));
        service.recordPresence(1, PresenceStatus.OFFLINE, null);

        List<StoredHistoryEntry> history = service.history(1, HistoryLogType.PRESENCE);

        assertThat(history).extracting(StoredHistoryEntry::recordedAt).containsExactly(NOW, NOW.minusSeconds(20));
        assertThat(new String(history.get(0).value(), StandardCharsets.UTF_8)).isEqualTo("offline");
        assertThat(history.get(0).contentType()).isEqualTo("text/plain");
    }

    @Test
    void missingPresenceStatusIsRecordedAsOffline() {
        service.recordPresence(1, null, NOW);

        assertThat(new String(service.history(1, HistoryLogType.PRESENCE).get(0).value(), StandardCharsets.UTF_8))
                .isEqualTo("offline");
    }

    @Test
    void avatarKeepsMimeFormatAndSkipsRepeats() {
        byte[] image = {(byte) 0x89, 'P', 'N', 'G'};

        assertThat(service.recordAvatar(1, "image/png", image, NOW).stored()).isTrue();
        assertThat(service.recordAvatar(1, "image/png", image.clone(), NOW.plusSeconds(1)).stored()).isFalse();

        List<StoredHistoryEntry> history = service.history(1, HistoryLogType.AVATAR);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).contentType()).isEqualTo("image/png");
        assertThat(history.get(0).value()).containsExactly(image);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> service.recordAvatar(1, "image/png", new byte[0], NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recordAvatar(1, " ", new byte[] {1}, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recordName(1, "", NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.calls).isEmpty();
    }

    @Test
    void namesAreStoredAsUtf8() {
        service.recordName(1, "Zoë", NOW);

        assertThat(new String(service.history(1, HistoryLogType.NAME).get(0).value(), StandardCharsets.UTF_8))
                .isEqualTo("Zoë");
    }

    @Test
    void parsesStatusesAndLogTypes() {
        assertThat(PresenceStatus.fromValue("DnD")).isEqualTo(PresenceStatus.DND);
        assertThat(PresenceStatus.fromValue("")).isEqualTo(PresenceStatus.OFFLINE);
        assertThat(HistoryLogType.fromValue(" avatar ")).isEqualTo(HistoryLogType.AVATAR);
        assertThatThrownBy(() -> PresenceStatus.fromValue("away")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> HistoryLogType.fromValue("nick")).isInstanceOf(ConfigurationException.class);
    }
}
