package io.github.drompincen.collabsync.runtime.profile;

import io.github.drompincen.collabsync.persistence.document.ClientProfileDocument;
import io.github.drompincen.collabsync.persistence.repository.ClientProfileRepository;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoProfileStoreTest {

    @Mock
    private ClientProfileRepository profileRepository;

    private MongoProfileStore profileStore;

    @BeforeEach
    void setUp() {
        profileStore = new MongoProfileStore(profileRepository);
    }

    @Test
    void loadMapsDocumentToProfile() {
        Participant user = Participant.of("u1", "Alice", "alice@example.com", Role.EDITOR);
        ClientProfileDocument doc = new ClientProfileDocument();
        doc.setProfileId("default");
        doc.setUser(user);
        doc.setLastSessionId("s1");
        doc.setSyncEnabled(false);
        doc.setAutoReconnect(true);
        when(profileRepository.findById("default")).thenReturn(Optional.of(doc));

        Optional<ClientProfile> profile = profileStore.load("default");

        assertThat(profile).isPresent();
        assertThat(profile.get().user()).isEqualTo(user);
        assertThat(profile.get().lastSessionId()).isEqualTo("s1");
        assertThat(profile.get().syncEnabled()).isFalse();
        assertThat(profile.get().autoReconnect()).isTrue();
    }

    @Test
    void loadReturnsEmptyWhenMissing() {
        when(profileRepository.findById("default")).thenReturn(Optional.empty());

        assertThat(profileStore.load("default")).isEmpty();
    }

    @Test
    void saveWritesAllFields() {
        Participant user = Participant.of("u1", "Alice", "alice@example.com", Role.EDITOR);
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        when(profileRepository.findById("default")).thenReturn(Optional.empty());
        when(profileRepository.save(any(ClientProfileDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        profileStore.save(new ClientProfile("default", user, "s1", true, false, now));

        ArgumentCaptor<ClientProfileDocument> captor = ArgumentCaptor.forClass(ClientProfileDocument.class);
        verify(profileRepository).save(captor.capture());
        ClientProfileDocument saved = captor.getValue();
        assertThat(saved.getProfileId()).isEqualTo("default");
        assertThat(saved.getUserId()).isEqualTo("u1");
        assertThat(saved.getLastSessionId()).isEqualTo("s1");
        assertThat(saved.isAutoReconnect()).isFalse();
        assertThat(saved.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    void saveUpdatesExistingDocument() {
        ClientProfileDocument existing = new ClientProfileDocument();
        existing.setProfileId("default");
        existing.setLastSessionId("old");
        when(profileRepository.findById("default")).thenReturn(Optional.of(existing));
        when(profileRepository.save(any(ClientProfileDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        profileStore.save(new ClientProfile("default", null, null, true, true, Instant.now()));

        verify(profileRepository).save(existing);
        assertThat(existing.getLastSessionId()).isNull();
        assertThat(existing.getUserId()).isNull();
    }
}
