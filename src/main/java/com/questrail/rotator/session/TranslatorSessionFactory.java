package com.questrail.rotator.session;

import com.questrail.rotator.transport.ClientConnection;

/**
 * Creates one session for each accepted client connection.
 */
@FunctionalInterface
public interface TranslatorSessionFactory {
    TranslatorSession create(String sessionId, ClientConnection client);
}
