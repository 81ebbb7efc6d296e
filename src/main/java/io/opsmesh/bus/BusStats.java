package io.opsmesh.bus;

import java.util.List;

public record BusStats(
        long published,
        long delivered,
        long expired,
        long backpressureDropped,
        long handlerFailures,
        int pending,
        int subscriptions,
        List<SubscriptionStats> subscribers
) {
    public record SubscriptionStats(
            String subscriptionId,
            String subscriberId,
            String topic,
            long delivered,
            long failed
    ) {
    }
}
