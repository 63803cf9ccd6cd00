package io.github.drompincen.collabsync.runtime.profile;

import java.util.Optional;

public interface ProfileStore {

    Optional<ClientProfile> load(String profileId);

    void save(ClientProfile profile);
}
