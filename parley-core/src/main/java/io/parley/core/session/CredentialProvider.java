package io.parley.core.session;

import java.util.Optional;

@FunctionalInterface
public interface CredentialProvider {

    Optional<SessionCredentials> lookup(String ownerId);

    static CredentialProvider none() {
        return ownerId -> Optional.empty();
    }
}
