package io.chunkvault.session;

import java.time.Instant;
import java.util.List;

/**
 * Resume information for an upload session.
 */
public record SessionStatus(
    String uploadId,
    String objectId,
    long version,
    SessionState state,
    int totalChunks,
    int receivedChunks,
    List<Integer> missingChunks,
    double progress,
    Instant createdAt,
    Instant expiresAt
) {}
