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

/**
 * Per queue cache caps in effect for one topic. Immutable, replaced as a whole.
 */
public final class QueueThresholds {
    private final int countPerQueue;
    private final long sizePerQueue;

    public QueueThresholds(int countPerQueue, long sizePerQueue) {
        this.countPerQueue = countPerQueue;
        this.sizePerQueue = sizePerQueue;
    }

    public int getCountPerQueue() {
        return countPerQueue;
    }

    /**
     * in bytes, measured by message body only
     */
    public long getSizePerQueue() {
        return sizePerQueue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueThresholds that = (QueueThresholds) o;
        return countPerQueue == that.countPerQueue && sizePerQueue == that.sizePerQueue;
    }

    @Override
    public int hashCode() {
        return 31 * countPerQueue + Long.hashCode(sizePerQueue);
    }

    @Override
    public String toString() {
        return "QueueThresholds{" +
                "countPerQueue=" + countPerQueue +
                ", sizePerQueue=" + sizePerQueue +
                '}';
    }
}
