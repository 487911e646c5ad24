package com.homework.core.service;

import com.homework.common.util.FileUtils;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits at most one run per document identity at a time.
 *
 * <p>Identities are file names normalised with {@link FileUtils#sanitizeFileName},
 * so an upload and an inbox file with the same name share one slot.
 */
@Component
public class DocumentRunGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String documentId) {
        return inFlight.add(identity(documentId));
    }

    public void release(String documentId) {
        inFlight.remove(identity(documentId));
    }

    public boolean isRunning(String documentId) {
        return inFlight.contains(identity(documentId));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    static String identity(String documentId) {
        return FileUtils.sanitizeFileName(documentId);
    }
}
