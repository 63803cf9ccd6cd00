package io.github.drompincen.collabsync.persistence.document;

import io.github.drompincen.collabsync.protocol.api.Participant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "client_profiles")
public class ClientProfileDocument {

    @Id
    private String profileId;

    @Indexed
    private String userId;

    private Participant user;
    private String lastSessionId;
    private boolean syncEnabled = true;
    private boolean autoReconnect = true;
    private Instant updatedAt;

    public ClientProfileDocument() {}

    public String getProfileId() { return profileId; }
    public void setProfileId(String profileId) { this.profileId = profileId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Participant getUser() { return user; }
    public void setUser(Participant user) { this.user = user; }

    public String getLastSessionId() { return lastSessionId; }
    public void setLastSessionId(String lastSessionId) { this.lastSessionId = lastSessionId; }

    public boolean isSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public boolean isAutoReconnect() { return autoReconnect; }
    public void setAutoReconnect(boolean autoReconnect) { this.autoReconnect = autoReconnect; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
