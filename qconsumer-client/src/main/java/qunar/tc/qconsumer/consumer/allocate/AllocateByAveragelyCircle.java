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
 * Deals queues out round robin: queue {@code i} goes to client {@code i % clients}.
 */
public class AllocateByAveragelyCircle extends AbstractAllocateStrategy {
    public static final String NAME = "AVG_BY_CIRCLE";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<MessageQueue> doAllocate(int index, List<MessageQueue> queues, int clientCount) {
        final List<MessageQueue> result = new ArrayList<>();
        for (int i = index; i < queues.size(); i += clientCount) {
            result.add(queues.get(i));
        }
        return result;
    }
}
