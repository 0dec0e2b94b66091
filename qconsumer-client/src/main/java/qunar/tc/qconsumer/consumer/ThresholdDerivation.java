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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/**
 * Splits topic level cache limits evenly across the queues assigned to this consumer.
 * <p>
 * For example a topic limit of 1000 messages over 10 assigned queues caps each queue at 100 messages.
 * A limited topic threshold overrides the configured per queue value, and the result is never below 1.
 */
public final class ThresholdDerivation {

    private ThresholdDerivation() {
    }

    /**
     * @param configured     per queue caps from the consumer options
     * @param current        caps in effect right now, kept as is while no queue is assigned
     * @param topicCount     topic level message count limit
     * @param topicSize      topic level message size limit, in bytes
     * @param assignedQueues queues of the topic currently assigned to this consumer
     */
    public static QueueThresholds derive(QueueThresholds configured, QueueThresholds current,
                                         Threshold topicCount, Threshold topicSize, int assignedQueues) {
        Preconditions.checkArgument(assignedQueues >= 0, "assigned queue count must not be negative: %s", assignedQueues);

        if (!topicCount.isLimited() && !topicSize.isLimited()) {
            return configured;
        }
        if (assignedQueues == 0) {
            return current;
        }

        final int count = topicCount.isLimited()
                ? Ints.saturatedCast(perQueue(topicCount.value(), assignedQueues))
                : configured.getCountPerQueue();
        final long size = topicSize.isLimited()
                ? perQueue(topicSize.value(), assignedQueues)
                : configured.getSizePerQueue();
        return new QueueThresholds(count, size);
    }

    static long perQueue(long topicLimit, int assignedQueues) {
        return Math.max(1, topicLimit / assignedQueues);
    }
}
