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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One consumption invocation: a batch of messages taken from a single queue.
 */
public final class ConsumeRequest {
    private final String consumerGroup;
    private final MessageQueue queue;
    private final List<MessageView> messages;

    public ConsumeRequest(String consumerGroup, MessageQueue queue, List<? extends MessageView> messages) {
        this.consumerGroup = consumerGroup;
        this.queue = queue;
        this.messages = Collections.unmodifiableList(new ArrayList<MessageView>(messages));
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public MessageQueue getQueue() {
        return queue;
    }

    public String getTopic() {
        return queue.getTopic();
    }

    public List<MessageView> getMessages() {
        return messages;
    }

    @Override
    public String toString() {
        return "ConsumeRequest{" +
                "consumerGroup='" + consumerGroup + '\'' +
                ", queue=" + queue +
                ", messages=" + messages.size() +
                '}';
    }
}
