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

import com.google.common.collect.ImmutableList;
import qunar.tc.qconsumer.AllocateStrategy;
import qunar.tc.qconsumer.MessageQueue;

import java.util.List;

/**
 * Always owns the same fixed queues, whatever the group looks like.
 */
public class AllocateByConfig implements AllocateStrategy {
    public static final String NAME = "CONFIG";

    private final List<MessageQueue> queues;

    public AllocateByConfig(List<MessageQueue> queues) {
        this.queues = ImmutableList.copyOf(queues);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<MessageQueue> allocate(String consumerGroup, String currentClientId, List<MessageQueue> allQueues, List<String> allClientIds) {
        return queues;
    }

    @Override
    public String toString() {
        return NAME + queues;
    }
}
