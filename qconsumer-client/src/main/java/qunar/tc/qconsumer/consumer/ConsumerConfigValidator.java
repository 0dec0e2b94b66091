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

import com.google.common.base.Strings;
import qunar.tc.qconsumer.ConsumeFromWhere;
import qunar.tc.qconsumer.MessageModel;
import qunar.tc.qconsumer.common.ClientOptions;
import qunar.tc.qconsumer.utils.ConsumeTimestamps;
import qunar.tc.qconsumer.utils.NetworkUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross field checks run once when options are built.
 */
final class ConsumerConfigValidator {
    static final long MIB = 1024L * 1024L;

    private ConsumerConfigValidator() {
    }

    static List<String> validate(final ConsumerOptions.Builder builder) {
        final List<String> problems = new ArrayList<>();
        final ClientOptions.Builder client = builder.getClientOptions();

        if (Strings.isNullOrEmpty(client.getGroupName())) {
            problems.add("consumer group is empty");
        }

        if (client.getNameServerAddrs().isEmpty()) {
            problems.add("name server address is empty");
        }
        for (String address : client.getNameServerAddrs()) {
            if (!NetworkUtils.isValid(address)) {
                problems.add("name server address should be host:port, but received " + address);
            }
        }

        if (builder.getConsumerModel() == null) {
            problems.add("consumer model is not set");
        }
        if (builder.getFromWhere() == null) {
            problems.add("consume from where is not set");
        }
        if (builder.getConsumerModel() == MessageModel.CLUSTERING && builder.getAllocateStrategy() == null) {
            problems.add("allocate strategy is required by clustering consumer");
        }
        if (builder.isConsumeOrderly() && builder.getConsumerModel() == MessageModel.BROADCASTING) {
            problems.add("orderly consumption is not supported by broadcasting consumer");
        }
        if (builder.getFromWhere() == ConsumeFromWhere.CONSUME_FROM_TIMESTAMP
                && !ConsumeTimestamps.isValid(builder.getConsumeTimestamp())) {
            problems.add("consume timestamp should be " + ConsumeTimestamps.PATTERN + ", but received " + builder.getConsumeTimestamp());
        }

        checkRange(problems, "consumeConcurrentlyMaxSpan", builder.getConsumeConcurrentlyMaxSpan(), 1, 65535);
        checkRange(problems, "pullThresholdForQueue", builder.getPullThresholdForQueue(), 1, 65535);
        if (builder.getPullThresholdForTopic().isLimited()) {
            checkRange(problems, "pullThresholdForTopic", builder.getPullThresholdForTopic().value(), 1, 6553500);
        }
        checkRange(problems, "pullThresholdSizeForQueue", builder.getPullThresholdSizeForQueue(), MIB, 1024 * MIB);
        if (builder.getPullThresholdSizeForTopic().isLimited()) {
            checkRange(problems, "pullThresholdSizeForTopic", builder.getPullThresholdSizeForTopic().value(), MIB, 102400 * MIB);
        }
        checkRange(problems, "pullInterval", builder.getPullIntervalMillis(), 0, 65535);
        checkRange(problems, "consumeMessageBatchMaxSize", builder.getConsumeMessageBatchMaxSize(), 1, 1024);
        checkRange(problems, "pullBatchSize", builder.getPullBatchSize(), 1, 1024);

        if (!builder.getMaxReconsumeTimes().isDefault() && builder.getMaxReconsumeTimes().resolve() < 0) {
            problems.add("maxReconsumeTimes should be -1 or not negative, but received " + builder.getMaxReconsumeTimes());
        }
        if (client.getRetryTimes() < 0) {
            problems.add("retryTimes should not be negative");
        }
        checkPositive(problems, "pullTimeout", builder.getPullTimeoutMillis());
        checkPositive(problems, "consumeTimeout", builder.getConsumeTimeoutMillis());
        checkPositive(problems, "suspendCurrentQueueTime", builder.getSuspendCurrentQueueTimeMillis());

        return problems;
    }

    private static void checkRange(List<String> problems, String name, long value, long min, long max) {
        if (value < min || value > max) {
            problems.add(name + " out of range [" + min + ", " + max + "], but received " + value);
        }
    }

    private static void checkPositive(List<String> problems, String name, long value) {
        if (value <= 0) {
            problems.add(name + " should be positive, but received " + value);
        }
    }
}
