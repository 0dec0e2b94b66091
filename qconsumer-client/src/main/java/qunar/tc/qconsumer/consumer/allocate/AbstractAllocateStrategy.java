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

package qunar.tc.qconsumer.consumer.allocate;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.AllocateStrategy;
import qunar.tc.qconsumer.MessageQueue;

import java.util.List;

/**
 * Sorts and deduplicates the inputs so that every member of the group computes the same split.
 */
abstract class AbstractAllocateStrategy implements AllocateStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractAllocateStrategy.class);

    @Override
    public List<MessageQueue> allocate(String consumerGroup, String currentClientId, List<MessageQueue> allQueues, List<String> allClientIds) {
        if (Strings.isNullOrEmpty(currentClientId) || allQueues == null || allQueues.isEmpty()
                || allClientIds == null || allClientIds.isEmpty()) {
            return ImmutableList.of();
        }

        final List<MessageQueue> queues = Lists.newArrayList(Sets.newTreeSet(allQueues));
        final List<String> clients = Lists.newArrayList(Sets.newTreeSet(allClientIds));
        final int index = clients.indexOf(currentClientId);
        if (index < 0) {
            LOG.warn("client is not in the online client list. consumerGroup={}, clientId={}, clients={}", consumerGroup, currentClientId, clients);
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(doAllocate(index, queues, clients.size()));
    }

    /**
     * @param index       position of the current client among the sorted clients
     * @param queues      sorted queues
     * @param clientCount number of clients
     */
    protected abstract List<MessageQueue> doAllocate(int index, List<MessageQueue> queues, int clientCount);

    @Override
    public String toString() {
        return getName();
    }
}
