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
 * Where a consumer group with no committed offset starts reading a queue.
 */
public enum ConsumeFromWhere {

    CONSUME_FROM_LAST_OFFSET,

    CONSUME_FROM_FIRST_OFFSET,

    /**
     * start from the first message stored at or after the configured consume timestamp
     */
    CONSUME_FROM_TIMESTAMP;

    public static ConsumeFromWhere parse(String name) {
        if (name == null) return null;
        for (ConsumeFromWhere where : values()) {
            if (where.name().equalsIgnoreCase(name.trim())) {
                return where;
            }
        }
        return null;
    }
}
