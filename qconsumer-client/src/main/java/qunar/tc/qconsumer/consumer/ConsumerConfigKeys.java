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
 * Property names understood by {@link Options#fromConfig(qunar.tc.qconsumer.configuration.DynamicConfig)}.
 */
public final class ConsumerConfigKeys {
    public static final String GROUP = "consumer.group";
    // comma separated host:port list
    public static final String NAME_SERVERS = "consumer.nameServers";
    public static final String INSTANCE_NAME = "consumer.instanceName";
    public static final String NAMESPACE = "consumer.namespace";
    public static final String ACL_ENABLED = "consumer.acl.enabled";
    public static final String VIP_CHANNEL_ENABLED = "consumer.vipChannel.enabled";
    public static final String RETRY_TIMES = "consumer.retryTimes";

    public static final String MODEL = "consumer.model";
    public static final String FROM_WHERE = "consumer.fromWhere";
    public static final String CONSUME_TIMESTAMP = "consumer.consumeTimestamp";
    public static final String ORDERLY = "consumer.orderly";
    public static final String ALLOCATE_STRATEGY = "consumer.allocateStrategy";

    public static final String PULL_TIMEOUT_MILLIS = "consumer.pullTimeoutMillis";
    public static final String CONSUME_CONCURRENTLY_MAX_SPAN = "consumer.consumeConcurrentlyMaxSpan";
    public static final String PULL_THRESHOLD_FOR_QUEUE = "consumer.pullThresholdForQueue";
    // bytes
    public static final String PULL_THRESHOLD_SIZE_FOR_QUEUE = "consumer.pullThresholdSizeForQueue";
    // <= 0 means unlimited
    public static final String PULL_THRESHOLD_FOR_TOPIC = "consumer.pullThresholdForTopic";
    public static final String PULL_THRESHOLD_SIZE_FOR_TOPIC = "consumer.pullThresholdSizeForTopic";
    public static final String PULL_INTERVAL_MILLIS = "consumer.pullIntervalMillis";
    public static final String CONSUME_MESSAGE_BATCH_MAX_SIZE = "consumer.consumeMessageBatchMaxSize";
    public static final String PULL_BATCH_SIZE = "consumer.pullBatchSize";
    public static final String POST_SUBSCRIPTION_WHEN_PULL = "consumer.postSubscriptionWhenPull";
    // -1 means the default
    public static final String MAX_RECONSUME_TIMES = "consumer.maxReconsumeTimes";
    public static final String SUSPEND_CURRENT_QUEUE_TIME_MILLIS = "consumer.suspendCurrentQueueTimeMillis";
    public static final String CONSUME_TIMEOUT_MILLIS = "consumer.consumeTimeoutMillis";

    private ConsumerConfigKeys() {
    }
}
