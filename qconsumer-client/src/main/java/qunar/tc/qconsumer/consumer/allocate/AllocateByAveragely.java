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

import qunar.tc.qconsumer.MessageQueue;

import java.util.ArrayList;
import java.util.List;

/**
 * Gives every client a contiguous range of queues. When the queues do not divide evenly the first
 * {@code queues % clients} clients get one extra queue, e.g. 8 queues over 3 clients split 3/3/2.
 * Clients beyond the queue count get nothing.
 */
public class AllocateByAveragely extends AbstractAllocateStrategy {
    public static final String NAME = "AVG";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<MessageQueue> doAllocate(int index, List<MessageQueue> queues, int clientCount) {
        final int queueCount = queues.size();
        final int mod = queueCount % clientCount;
        final int averageSize = queueCount <= clientCount
                ? 1
                : (mod > 0 && index < mod ? queueCount / clientCount + 1 : queueCount / clientCount);
        final int startIndex = (mod > 0 && index < mod) ? index * averageSize : index * averageSize + mod;
        final int range = Math.min(averageSize, queueCount - startIndex);

        final List<MessageQueue> result = new ArrayList<>(Math.max(range, 0));
        for (int i = 0; i < range; i++) {
            result.add(queues.get(startIndex + i));
        }
        return result;
    }
}
