package io.github.drompincen.collabsync.runtime.profile;

import io.github.drompincen.collabsync.persistence.document.ClientProfileDocument;
import io.github.drompincen.collabsync.persistence.repository.ClientProfileRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class MongoProfileStore implements ProfileStore {

    private final ClientProfileRepository profileRepository;

    public MongoProfileStore(ClientProfileRepository profileRepository) {
        this.profileRepository = profileRepository;
    }

    @Override
    public Optional<ClientProfile> load(String profileId) {
        return profileRepository.findById(profileId).map(this::toProfile);
    }

    @Override
    public void save(ClientProfile profile) {
        var doc = profileRepository.findById(profile.profileId()).orElseGet(ClientProfileDocument::new);
        doc.setProfileId(profile.profileId());
        doc.setUserId(profile.user() != null ? profile.user().id() : null);
        doc.setUser(profile.user());
        doc.setLastSessionId(profile.lastSessionId());
        doc.setSyncEnabled(profile.syncEnabled());
        doc.setAutoReconnect(profile.autoReconnect());
        doc.setUpdatedAt(profile.updatedAt());
        profileRepository.save(doc);
    }

    private ClientProfile toProfile(ClientProfileDocument doc) {
        return new ClientProfile(doc.getProfileId(), doc.getUser(), doc.getLastSessionId(),
                doc.isSyncEnabled(), doc.isAutoReconnect(), doc.getUpdatedAt());
    }
}
