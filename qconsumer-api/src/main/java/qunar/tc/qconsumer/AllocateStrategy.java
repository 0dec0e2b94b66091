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

package qunar.tc.qconsumer;

import java.util.List;

/**
 * Divides the queues of a topic among the online members of a consumer group.
 * <p>
 * Every member runs the same strategy over the same inputs, so implementations must be deterministic
 * and must not depend on the order of the given lists.
 */
public interface AllocateStrategy {

    String getName();

    /**
     * @param consumerGroup   group being rebalanced
     * @param currentClientId id of the member asking for its share
     * @param allQueues       every queue of the topic
     * @param allClientIds    every online member of the group
     * @return the queues owned by {@code currentClientId}, never null
     */
    List<MessageQueue> allocate(String consumerGroup, String currentClientId, List<MessageQueue> allQueues, List<String> allClientIds);
}
