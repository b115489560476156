package io.agentrelay.broker;

public record BrokerStats(
        int registeredAgents,
        int conversations,
        int activeConversations,
        int knownTaskRequests,
        long routedTotal,
        long deniedTotal,
        long malformedTotal,
        long droppedInviteTotal,
        long droppedNoticeTotal,
        long auditFailureTotal,
        boolean shutDown
) {
}
