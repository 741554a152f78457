package com.cascade.flowqueue.model;

import java.util.List;

/**
 * Point-in-time projection of the flow queue.
 */
public record FlowQueueStatus(int activeQueues,
                              long totalMessagesQueued,
                              double processingSpeed,
                              int instancesInUse,
                              List<QueuedFlow> queuedFlows) {
}
