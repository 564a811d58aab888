package io.modelpipe.model;

public record ProjectLock(
        String ownerAgentId,
        String ownerSessionId,
        String token,
        long acquiredAtMs,
        long heartbeatAtMs,
        long expiresAtMs,
        String mode
) {
    public static final String MODE_MCP = "mcp";

    public boolean expired(long nowMs) {
        return expiresAtMs <= nowMs;
    }

    public boolean ownedBy(String agentId, String sessionId) {
        return ownerAgentId.equals(agentId)
                && (ownerSessionId == null ? sessionId == null : ownerSessionId.equals(sessionId));
    }
}
