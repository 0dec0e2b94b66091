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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.AllocateStrategy;
import qunar.tc.qconsumer.ConsumeFromWhere;
import qunar.tc.qconsumer.Interceptor;
import qunar.tc.qconsumer.MessageModel;
import qunar.tc.qconsumer.common.ClientOptions;
import qunar.tc.qconsumer.consumer.allocate.AllocateByAveragely;
import qunar.tc.qconsumer.utils.ConsumeTimestamps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Settings of one push consumer, frozen before the consumer starts and read concurrently afterwards.
 * <p>
 * Assembled from {@link #defaults()} plus an ordered list of {@link ConsumerOption}s:
 * <pre>
 * ConsumerOptions options = ConsumerOptions.create(
 *         Options.withGroupName("order_consumer"),
 *         Options.withNameServer("127.0.0.1:9876"),
 *         Options.withConsumerModel(MessageModel.CLUSTERING),
 *         Options.withPullThresholdForTopic(Threshold.limited(1000)));
 * </pre>
 */
public final class ConsumerOptions {
    private static final Logger LOG = LoggerFactory.getLogger(ConsumerOptions.class);

    public static final String DEFAULT_CONSUMER_GROUP = "DEFAULT_CONSUMER";

    static final long DEFAULT_PULL_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);
    static final int DEFAULT_CONSUME_CONCURRENTLY_MAX_SPAN = 2000;
    static final int DEFAULT_PULL_THRESHOLD_FOR_QUEUE = 1000;
    static final long DEFAULT_PULL_THRESHOLD_SIZE_FOR_QUEUE = 100 * ConsumerConfigValidator.MIB;
    static final int DEFAULT_CONSUME_MESSAGE_BATCH_MAX_SIZE = 1;
    static final int DEFAULT_PULL_BATCH_SIZE = 32;
    static final long DEFAULT_SUSPEND_CURRENT_QUEUE_TIME_MILLIS = 1000;
    static final long DEFAULT_CONSUME_TIMEOUT_MILLIS = TimeUnit.MINUTES.toMillis(15);

    private final ClientOptions clientOptions;

    private final String consumeTimestamp;
    private final long pullTimeoutMillis;
    private final int consumeConcurrentlyMaxSpan;

    private final int pullThresholdForQueue;
    private final long pullThresholdSizeForQueue;
    private final Threshold pullThresholdForTopic;
    private final Threshold pullThresholdSizeForTopic;

    private final long pullIntervalMillis;
    private final int consumeMessageBatchMaxSize;
    private final int pullBatchSize;
    private final boolean postSubscriptionWhenPull;
    private final ReconsumeLimit maxReconsumeTimes;
    private final long suspendCurrentQueueTimeMillis;
    private final long consumeTimeoutMillis;

    private final MessageModel consumerModel;
    private final AllocateStrategy allocateStrategy;
    private final boolean consumeOrderly;
    private final ConsumeFromWhere fromWhere;

    private final InterceptorChain interceptors;

    private ConsumerOptions(Builder builder) {
        this.clientOptions = builder.clientOptions.build();
        this.consumeTimestamp = builder.consumeTimestamp;
        this.pullTimeoutMillis = builder.pullTimeoutMillis;
        this.consumeConcurrentlyMaxSpan = builder.consumeConcurrentlyMaxSpan;
        this.pullThresholdForQueue = builder.pullThresholdForQueue;
        this.pullThresholdSizeForQueue = builder.pullThresholdSizeForQueue;
        this.pullThresholdForTopic = builder.pullThresholdForTopic;
        this.pullThresholdSizeForTopic = builder.pullThresholdSizeForTopic;
        this.pullIntervalMillis = builder.pullIntervalMillis;
        this.consumeMessageBatchMaxSize = builder.consumeMessageBatchMaxSize;
        this.pullBatchSize = builder.pullBatchSize;
        this.postSubscriptionWhenPull = builder.postSubscriptionWhenPull;
        this.maxReconsumeTimes = builder.maxReconsumeTimes;
        this.suspendCurrentQueueTimeMillis = builder.suspendCurrentQueueTimeMillis;
        this.consumeTimeoutMillis = builder.consumeTimeoutMillis;
        this.consumerModel = builder.consumerModel;
        this.allocateStrategy = builder.allocateStrategy;
        this.consumeOrderly = builder.consumeOrderly;
        this.fromWhere = builder.fromWhere;
        this.interceptors = InterceptorChain.of(builder.interceptors);
    }

    /**
     * Builder holding the library defaults. The consumer model is left unset on purpose, it must be chosen.
     */
    public static Builder defaults() {
        return new Builder(ClientOptions.defaults().setGroupName(DEFAULT_CONSUMER_GROUP))
                .setConsumeTimestamp(ConsumeTimestamps.halfHourBefore(System.currentTimeMillis()))
                .setPullTimeoutMillis(DEFAULT_PULL_TIMEOUT_MILLIS)
                .setConsumeConcurrentlyMaxSpan(DEFAULT_CONSUME_CONCURRENTLY_MAX_SPAN)
                .setPullThresholdForQueue(DEFAULT_PULL_THRESHOLD_FOR_QUEUE)
                .setPullThresholdSizeForQueue(DEFAULT_PULL_THRESHOLD_SIZE_FOR_QUEUE)
                .setPullThresholdForTopic(Threshold.unlimited())
                .setPullThresholdSizeForTopic(Threshold.unlimited())
                .setPullIntervalMillis(0)
                .setConsumeMessageBatchMaxSize(DEFAULT_CONSUME_MESSAGE_BATCH_MAX_SIZE)
                .setPullBatchSize(DEFAULT_PULL_BATCH_SIZE)
                .setMaxReconsumeTimes(ReconsumeLimit.useDefault())
                .setSuspendCurrentQueueTimeMillis(DEFAULT_SUSPEND_CURRENT_QUEUE_TIME_MILLIS)
                .setConsumeTimeoutMillis(DEFAULT_CONSUME_TIMEOUT_MILLIS)
                .setAllocateStrategy(new AllocateByAveragely())
                .setFromWhere(ConsumeFromWhere.CONSUME_FROM_LAST_OFFSET);
    }

    public static ConsumerOptions create(ConsumerOption... options) throws ConsumerConfigException {
        return create(defaults(), options);
    }

    public static ConsumerOptions create(Builder base, ConsumerOption... options) throws ConsumerConfigException {
        return base.apply(options).build();
    }

    public ClientOptions getClientOptions() {
        return clientOptions;
    }

    public String getGroupName() {
        return clientOptions.getGroupName();
    }

    public List<String> getNameServerAddrs() {
        return clientOptions.getNameServerAddrs();
    }

    public String getConsumeTimestamp() {
        return consumeTimestamp;
    }

    public long getPullTimeoutMillis() {
        return pullTimeoutMillis;
    }

    public int getConsumeConcurrentlyMaxSpan() {
        return consumeConcurrentlyMaxSpan;
    }

    /**
     * Configured cap; the cap in effect for a topic is {@link FlowControlThresholds#current(String)}.
     */
    public int getPullThresholdForQueue() {
        return pullThresholdForQueue;
    }

    public long getPullThresholdSizeForQueue() {
        return pullThresholdSizeForQueue;
    }

    public Threshold getPullThresholdForTopic() {
        return pullThresholdForTopic;
    }

    public Threshold getPullThresholdSizeForTopic() {
        return pullThresholdSizeForTopic;
    }

    public long getPullIntervalMillis() {
        return pullIntervalMillis;
    }

    public int getConsumeMessageBatchMaxSize() {
        return consumeMessageBatchMaxSize;
    }

    public int getPullBatchSize() {
        return pullBatchSize;
    }

    public boolean isPostSubscriptionWhenPull() {
        return postSubscriptionWhenPull;
    }

    /**
     * @return effective limit, {@value ReconsumeLimit#DEFAULT_MAX_RECONSUME_TIMES} unless set explicitly
     */
    public int getMaxReconsumeTimes() {
        return maxReconsumeTimes.resolve();
    }

    public ReconsumeLimit getReconsumeLimit() {
        return maxReconsumeTimes;
    }

    public long getSuspendCurrentQueueTimeMillis() {
        return suspendCurrentQueueTimeMillis;
    }

    public long getConsumeTimeoutMillis() {
        return consumeTimeoutMillis;
    }

    public MessageModel getConsumerModel() {
        return consumerModel;
    }

    public AllocateStrategy getAllocateStrategy() {
        return allocateStrategy;
    }

    public boolean isConsumeOrderly() {
        return consumeOrderly;
    }

    public ConsumeFromWhere getFromWhere() {
        return fromWhere;
    }

    public InterceptorChain getInterceptors() {
        return interceptors;
    }

    public QueueThresholds configuredQueueThresholds() {
        return new QueueThresholds(pullThresholdForQueue, pullThresholdSizeForQueue);
    }

    /**
     * A fresh holder of derived per queue thresholds, owned by the consumer using these options.
     */
    public FlowControlThresholds newFlowControl() {
        return new FlowControlThresholds(configuredQueueThresholds(), pullThresholdForTopic, pullThresholdSizeForTopic);
    }

    public Builder toBuilder() {
        final Builder builder = new Builder(clientOptions.toBuilder())
                .setConsumeTimestamp(consumeTimestamp)
                .setPullTimeoutMillis(pullTimeoutMillis)
                .setConsumeConcurrentlyMaxSpan(consumeConcurrentlyMaxSpan)
                .setPullThresholdForQueue(pullThresholdForQueue)
                .setPullThresholdSizeForQueue(pullThresholdSizeForQueue)
                .setPullThresholdForTopic(pullThresholdForTopic)
                .setPullThresholdSizeForTopic(pullThresholdSizeForTopic)
                .setPullIntervalMillis(pullIntervalMillis)
                .setConsumeMessageBatchMaxSize(consumeMessageBatchMaxSize)
                .setPullBatchSize(pullBatchSize)
                .setPostSubscriptionWhenPull(postSubscriptionWhenPull)
                .setMaxReconsumeTimes(maxReconsumeTimes)
                .setSuspendCurrentQueueTimeMillis(suspendCurrentQueueTimeMillis)
                .setConsumeTimeoutMillis(consumeTimeoutMillis)
                .setConsumerModel(consumerModel)
                .setAllocateStrategy(allocateStrategy)
                .setConsumeOrderly(consumeOrderly)
                .setFromWhere(fromWhere);
        builder.addInterceptors(interceptors.getInterceptors());
        return builder;
    }

    @Override
    public String toString() {
        return "ConsumerOptions{" +
                "clientOptions=" + clientOptions +
                ", consumeTimestamp='" + consumeTimestamp + '\'' +
                ", pullTimeoutMillis=" + pullTimeoutMillis +
                ", consumeConcurrentlyMaxSpan=" + consumeConcurrentlyMaxSpan +
                ", pullThresholdForQueue=" + pullThresholdForQueue +
                ", pullThresholdSizeForQueue=" + pullThresholdSizeForQueue +
                ", pullThresholdForTopic=" + pullThresholdForTopic +
                ", pullThresholdSizeForTopic=" + pullThresholdSizeForTopic +
                ", pullIntervalMillis=" + pullIntervalMillis +
                ", consumeMessageBatchMaxSize=" + consumeMessageBatchMaxSize +
                ", pullBatchSize=" + pullBatchSize +
                ", postSubscriptionWhenPull=" + postSubscriptionWhenPull +
                ", maxReconsumeTimes=" + maxReconsumeTimes +
                ", suspendCurrentQueueTimeMillis=" + suspendCurrentQueueTimeMillis +
                ", consumeTimeoutMillis=" + consumeTimeoutMillis +
                ", consumerModel=" + consumerModel +
                ", allocateStrategy=" + (allocateStrategy == null ? null : allocateStrategy.getName()) +
                ", consumeOrderly=" + consumeOrderly +
                ", fromWhere=" + fromWhere +
                ", interceptors=" + interceptors.size() +
                '}';
    }

    /**
     * Mutable while options are being assembled; discarded once {@link #build()} succeeds.
     */
    public static final class Builder {
        private final ClientOptions.Builder clientOptions;

        private String consumeTimestamp;
        private long pullTimeoutMillis;
        private int consumeConcurrentlyMaxSpan;
        private int pullThresholdForQueue;
        private long pullThresholdSizeForQueue;
        private Threshold pullThresholdForTopic = Threshold.unlimited();
        private Threshold pullThresholdSizeForTopic = Threshold.unlimited();
        private long pullIntervalMillis;
        private int consumeMessageBatchMaxSize;
        private int pullBatchSize;
        private boolean postSubscriptionWhenPull;
        private ReconsumeLimit maxReconsumeTimes = ReconsumeLimit.useDefault();
        private long suspendCurrentQueueTimeMillis;
        private long consumeTimeoutMillis;
        private MessageModel consumerModel;
        private AllocateStrategy allocateStrategy;
        private boolean consumeOrderly;
        private ConsumeFromWhere fromWhere;
        private final List<Interceptor> interceptors = new ArrayList<>();

        private Builder(ClientOptions.Builder clientOptions) {
            this.clientOptions = clientOptions;
        }

        /**
         * Builder with nothing set, not even a group name or an allocate strategy.
         */
        public static Builder empty() {
            return new Builder(ClientOptions.empty());
        }

        public Builder apply(ConsumerOption... options) {
            if (options == null) return this;
            for (ConsumerOption option : options) {
                if (option != null) {
                    option.apply(this);
                }
            }
            return this;
        }

        public ConsumerOptions build() throws ConsumerConfigException {
            final List<String> problems = ConsumerConfigValidator.validate(this);
            if (!problems.isEmpty()) {
                throw new ConsumerConfigException(problems);
            }

            if (DEFAULT_CONSUMER_GROUP.equals(clientOptions.getGroupName())) {
                LOG.warn("consumer group is the default group {}, please specify your own group", DEFAULT_CONSUMER_GROUP);
            }
            final ConsumerOptions options = new ConsumerOptions(this);
            LOG.info("consumer options built. {}", options);
            return options;
        }

        public ClientOptions.Builder getClientOptions() {
            return clientOptions;
        }

        public String getConsumeTimestamp() {
            return consumeTimestamp;
        }

        public Builder setConsumeTimestamp(String consumeTimestamp) {
            this.consumeTimestamp = consumeTimestamp;
            return this;
        }

        public long getPullTimeoutMillis() {
            return pullTimeoutMillis;
        }

        public Builder setPullTimeoutMillis(long pullTimeoutMillis) {
            this.pullTimeoutMillis = pullTimeoutMillis;
            return this;
        }

        public int getConsumeConcurrentlyMaxSpan() {
            return consumeConcurrentlyMaxSpan;
        }

        public Builder setConsumeConcurrentlyMaxSpan(int consumeConcurrentlyMaxSpan) {
            this.consumeConcurrentlyMaxSpan = consumeConcurrentlyMaxSpan;
            return this;
        }

        public int getPullThresholdForQueue() {
            return pullThresholdForQueue;
        }

        public Builder setPullThresholdForQueue(int pullThresholdForQueue) {
            this.pullThresholdForQueue = pullThresholdForQueue;
            return this;
        }

        public long getPullThresholdSizeForQueue() {
            return pullThresholdSizeForQueue;
        }

        public Builder setPullThresholdSizeForQueue(long pullThresholdSizeForQueue) {
            this.pullThresholdSizeForQueue = pullThresholdSizeForQueue;
            return this;
        }

        public Threshold getPullThresholdForTopic() {
            return pullThresholdForTopic;
        }

        public Builder setPullThresholdForTopic(Threshold pullThresholdForTopic) {
            this.pullThresholdForTopic = pullThresholdForTopic;
            return this;
        }

        public Threshold getPullThresholdSizeForTopic() {
            return pullThresholdSizeForTopic;
        }

        public Builder setPullThresholdSizeForTopic(Threshold pullThresholdSizeForTopic) {
            this.pullThresholdSizeForTopic = pullThresholdSizeForTopic;
            return this;
        }

        public long getPullIntervalMillis() {
            return pullIntervalMillis;
        }

        public Builder setPullIntervalMillis(long pullIntervalMillis) {
            this.pullIntervalMillis = pullIntervalMillis;
            return this;
        }

        public int getConsumeMessageBatchMaxSize() {
            return consumeMessageBatchMaxSize;
        }

        public Builder setConsumeMessageBatchMaxSize(int consumeMessageBatchMaxSize) {
            this.consumeMessageBatchMaxSize = consumeMessageBatchMaxSize;
            return this;
        }

        public int getPullBatchSize() {
            return pullBatchSize;
        }

        public Builder setPullBatchSize(int pullBatchSize) {
            this.pullBatchSize = pullBatchSize;
            return this;
        }

        public boolean isPostSubscriptionWhenPull() {
            return postSubscriptionWhenPull;
        }

        public Builder setPostSubscriptionWhenPull(boolean postSubscriptionWhenPull) {
            this.postSubscriptionWhenPull = postSubscriptionWhenPull;
            return this;
        }

        public ReconsumeLimit getMaxReconsumeTimes() {
            return maxReconsumeTimes;
        }

        public Builder setMaxReconsumeTimes(ReconsumeLimit maxReconsumeTimes) {
            this.maxReconsumeTimes = maxReconsumeTimes;
            return this;
        }

        public long getSuspendCurrentQueueTimeMillis() {
            return suspendCurrentQueueTimeMillis;
        }

        public Builder setSuspendCurrentQueueTimeMillis(long suspendCurrentQueueTimeMillis) {
            this.suspendCurrentQueueTimeMillis = suspendCurrentQueueTimeMillis;
            return this;
        }

        public long getConsumeTimeoutMillis() {
            return consumeTimeoutMillis;
        }

        public Builder setConsumeTimeoutMillis(long consumeTimeoutMillis) {
            this.consumeTimeoutMillis = consumeTimeoutMillis;
            return this;
        }

        public MessageModel getConsumerModel() {
            return consumerModel;
        }

        public Builder setConsumerModel(MessageModel consumerModel) {
            this.consumerModel = consumerModel;
            return this;
        }

        public AllocateStrategy getAllocateStrategy() {
            return allocateStrategy;
        }

        public Builder setAllocateStrategy(AllocateStrategy allocateStrategy) {
            this.allocateStrategy = allocateStrategy;
            return this;
        }

        public boolean isConsumeOrderly() {
            return consumeOrderly;
        }

        public Builder setConsumeOrderly(boolean consumeOrderly) {
            this.consumeOrderly = consumeOrderly;
            return this;
        }

        public ConsumeFromWhere getFromWhere() {
            return fromWhere;
        }

        public Builder setFromWhere(ConsumeFromWhere fromWhere) {
            this.fromWhere = fromWhere;
            return this;
        }

        public List<Interceptor> getInterceptors() {
            return Collections.unmodifiableList(interceptors);
        }

        public Builder addInterceptors(List<Interceptor> more) {
            for (Interceptor interceptor : more) {
                if (interceptor != null) {
                    interceptors.add(interceptor);
                }
            }
            return this;
        }
    }
}
