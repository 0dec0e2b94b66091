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

/**
 * How the queues of a subscribed topic are shared among the members of one consumer group.
 */
public enum MessageModel {

    /**
     * every member receives every message
     */
    BROADCASTING,

    /**
     * queues are divided among the members, each message is consumed by one member
     */
    CLUSTERING;

    public static MessageModel parse(String name) {
        if (name == null) return null;
        for (MessageModel model : values()) {
            if (model.name().equalsIgnoreCase(name.trim())) {
                return model;
            }
        }
        return null;
    }
}
