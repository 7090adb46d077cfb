package com.webchat.chatbackend.realtime;

import java.util.Optional;

/** Resolves the credential presented at connection time to a user id. */
public interface ConnectionAuthenticator {

    Optional<Long> authenticate(String token);
}
