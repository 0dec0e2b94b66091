/*
 * Copyright 2018 Qunar, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package qunar.tc.qconsumer.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live per queue thresholds of one consumer, one snapshot per subscribed topic.
 * <p>
 * Rebalance threads publish new snapshots through {@link #onQueueAssignmentChanged(String, int)} while pull
 * threads read them through {@link #current(String)}; a reader always sees a whole snapshot.
 */
public class FlowControlThresholds {
    private static final Logger LOG = LoggerFactory.getLogger(FlowControlThresholds.class);

    private final QueueThresholds configured;
    private final Threshold topicCount;
    private final Threshold topicSize;

    private final ConcurrentMap<String, QueueThresholds> topics = new ConcurrentHashMap<>();

    public FlowControlThresholds(QueueThresholds configured, Threshold topicCount, Threshold topicSize) {
        this.configured = configured;
        this.topicCount = topicCount;
        this.topicSize = topicSize;
    }

    /**
     * Derives and stores the snapshot of {@code topic} atomically with respect to {@link #remove(String)}.
     */
    public QueueThresholds onQueueAssignmentChanged(final String topic, final int assignedQueues) {
        final QueueThresholds[] previous = new QueueThresholds[1];
        final QueueThresholds next = topics.compute(topic, (k, prev) -> {
            final QueueThresholds current = prev == null ? configured : prev;
            previous[0] = current;
            return ThresholdDerivation.derive(configured, current, topicCount, topicSize, assignedQueues);
        });

        if (!next.equals(previous[0])) {
            LOG.info("queue thresholds changed. topic={}, assignedQueues={}, {} -> {}", topic, assignedQueues, previous[0], next);
        }
        return next;
    }

    public QueueThresholds current(final String topic) {
        final QueueThresholds thresholds = topics.get(topic);
        return thresholds == null ? configured : thresholds;
    }

    /**
     * @return true when the cache of a queue of {@code topic} is over either cap and pulling should pause
     */
    public boolean isFlowControlled(final String topic, final long cachedCount, final long cachedSize) {
        final QueueThresholds thresholds = current(topic);
        return cachedCount > thresholds.getCountPerQueue() || cachedSize > thresholds.getSizePerQueue();
    }

    public void remove(final String topic) {
        topics.remove(topic);
    }

    public QueueThresholds getConfigured() {
        return configured;
    }
}
