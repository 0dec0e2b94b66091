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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.AllocateStrategy;
import qunar.tc.qconsumer.ConsumeFromWhere;
import qunar.tc.qconsumer.Interceptor;
import qunar.tc.qconsumer.MessageModel;
import qunar.tc.qconsumer.configuration.DynamicConfig;
import qunar.tc.qconsumer.configuration.DynamicConfigLoader;
import qunar.tc.qconsumer.consumer.allocate.AllocateStrategies;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static qunar.tc.qconsumer.consumer.ConsumerConfigKeys.*;

/**
 * Factory of {@link ConsumerOption}s, one field (or one small group of fields) each.
 * Options given an empty or invalid value leave the builder as it was.
 */
public final class Options {
    private static final Logger LOG = LoggerFactory.getLogger(Options.class);

    private static final Splitter ADDRESS_SPLITTER = Splitter.on(CharMatcher.anyOf(",;")).trimResults().omitEmptyStrings();

    private Options() {
    }

    public static ConsumerOption withConsumerModel(final MessageModel model) {
        return builder -> {
            if (model != null) {
                builder.setConsumerModel(model);
            }
        };
    }

    public static ConsumerOption withConsumeFromWhere(final ConsumeFromWhere where) {
        return builder -> {
            if (where != null) {
                builder.setFromWhere(where);
            }
        };
    }

    /**
     * Appends interceptors. The first interceptor will be the outer most, while the last interceptor will be
     * the inner most wrapper around the real call.
     */
    public static ConsumerOption withInterceptor(final Interceptor... interceptors) {
        return builder -> {
            if (interceptors != null) {
                builder.addInterceptors(Arrays.asList(interceptors));
            }
        };
    }

    public static ConsumerOption withGroupName(final String group) {
        return builder -> {
            if (Strings.isNullOrEmpty(group)) return;
            builder.getClientOptions().setGroupName(group);
        };
    }

    public static ConsumerOption withNameServer(final List<String> nameServers) {
        return builder -> {
            if (nameServers == null) return;

            final ImmutableList.Builder<String> addresses = ImmutableList.builder();
            for (String nameServer : nameServers) {
                if (!Strings.isNullOrEmpty(nameServer) && !nameServer.trim().isEmpty()) {
                    addresses.add(nameServer.trim());
                }
            }
            final List<String> result = addresses.build();
            if (!result.isEmpty()) {
                builder.getClientOptions().setNameServerAddrs(result);
            }
        };
    }

    public static ConsumerOption withNameServer(final String... nameServers) {
        return withNameServer(nameServers == null ? null : Arrays.asList(nameServers));
    }

    public static ConsumerOption withVipChannel(final boolean enable) {
        return builder -> builder.getClientOptions().setVipChannelEnabled(enable);
    }

    public static ConsumerOption withAcl(final boolean enable) {
        return builder -> builder.getClientOptions().setAclEnabled(enable);
    }

    public static ConsumerOption withRetry(final int retries) {
        return builder -> builder.getClientOptions().setRetryTimes(retries);
    }

    public static ConsumerOption withInstanceName(final String instanceName) {
        return builder -> {
            if (Strings.isNullOrEmpty(instanceName)) return;
            builder.getClientOptions().setInstanceName(instanceName);
        };
    }

    public static ConsumerOption withNamespace(final String namespace) {
        return builder -> {
            if (Strings.isNullOrEmpty(namespace)) return;
            builder.getClientOptions().setNamespace(namespace);
        };
    }

    /**
     * Only read when consuming from {@link ConsumeFromWhere#CONSUME_FROM_TIMESTAMP}.
     *
     * @param timestamp second precision, yyyyMMddHHmmss
     */
    public static ConsumerOption withConsumeTimestamp(final String timestamp) {
        return builder -> {
            if (Strings.isNullOrEmpty(timestamp)) return;
            builder.setConsumeTimestamp(timestamp);
        };
    }

    public static ConsumerOption withPullTimeout(final long timeout, final TimeUnit unit) {
        return builder -> {
            if (unit == null) return;
            builder.setPullTimeoutMillis(unit.toMillis(timeout));
        };
    }

    /**
     * No effect on orderly consumption.
     */
    public static ConsumerOption withConsumeConcurrentlyMaxSpan(final int span) {
        return builder -> builder.setConsumeConcurrentlyMaxSpan(span);
    }

    public static ConsumerOption withPullThresholdForQueue(final int count) {
        return builder -> builder.setPullThresholdForQueue(count);
    }

    public static ConsumerOption withPullThresholdSizeForQueue(final long bytes) {
        return builder -> builder.setPullThresholdSizeForQueue(bytes);
    }

    /**
     * When limited, overrides the per queue count threshold with an even share over the assigned queues.
     */
    public static ConsumerOption withPullThresholdForTopic(final Threshold threshold) {
        return builder -> {
            if (threshold != null) {
                builder.setPullThresholdForTopic(threshold);
            }
        };
    }

    public static ConsumerOption withPullThresholdForTopic(final long legacyValue) {
        return withPullThresholdForTopic(Threshold.fromLegacy(legacyValue));
    }

    public static ConsumerOption withPullThresholdSizeForTopic(final Threshold threshold) {
        return builder -> {
            if (threshold != null) {
                builder.setPullThresholdSizeForTopic(threshold);
            }
        };
    }

    public static ConsumerOption withPullThresholdSizeForTopic(final long legacyBytes) {
        return withPullThresholdSizeForTopic(Threshold.fromLegacy(legacyBytes));
    }

    public static ConsumerOption withPullInterval(final long interval, final TimeUnit unit) {
        return builder -> {
            if (unit == null) return;
            builder.setPullIntervalMillis(unit.toMillis(interval));
        };
    }

    public static ConsumerOption withConsumeMessageBatchMaxSize(final int size) {
        return builder -> builder.setConsumeMessageBatchMaxSize(size);
    }

    public static ConsumerOption withPullBatchSize(final int size) {
        return builder -> builder.setPullBatchSize(size);
    }

    public static ConsumerOption withPostSubscriptionWhenPull(final boolean enable) {
        return builder -> builder.setPostSubscriptionWhenPull(enable);
    }

    /**
     * @param times -1 keeps the default of {@value ReconsumeLimit#DEFAULT_MAX_RECONSUME_TIMES}
     */
    public static ConsumerOption withMaxReconsumeTimes(final int times) {
        return builder -> builder.setMaxReconsumeTimes(ReconsumeLimit.fromLegacy(times));
    }

    public static ConsumerOption withSuspendCurrentQueueTime(final long time, final TimeUnit unit) {
        return builder -> {
            if (unit == null) return;
            builder.setSuspendCurrentQueueTimeMillis(unit.toMillis(time));
        };
    }

    public static ConsumerOption withConsumeTimeout(final long timeout, final TimeUnit unit) {
        return builder -> {
            if (unit == null) return;
            builder.setConsumeTimeoutMillis(unit.toMillis(timeout));
        };
    }

    public static ConsumerOption withConsumeOrderly(final boolean orderly) {
        return builder -> builder.setConsumeOrderly(orderly);
    }

    public static ConsumerOption withStrategy(final AllocateStrategy strategy) {
        return builder -> {
            if (strategy != null) {
                builder.setAllocateStrategy(strategy);
            }
        };
    }

    public static ConsumerOption chain(final ConsumerOption... options) {
        return builder -> builder.apply(options);
    }

    /**
     * Loads the named properties file through {@link DynamicConfigLoader} when the option is applied, then
     * behaves as {@link #fromConfig(DynamicConfig)}. A missing or unreadable file leaves the builder as it was.
     *
     * @param name file name, e.g. {@value DynamicConfigLoader#CONSUMER_CONFIG}
     */
    public static ConsumerOption fromConfig(final String name) {
        return builder -> {
            if (Strings.isNullOrEmpty(name)) return;

            final DynamicConfig config;
            try {
                config = DynamicConfigLoader.load(name, false);
            } catch (RuntimeException e) {
                LOG.warn("ignore consumer config file {} which cannot be loaded", name, e);
                return;
            }
            builder.apply(fromConfig(config));
        };
    }

    /**
     * Applies every key of {@link ConsumerConfigKeys} present in {@code config}. Values that cannot be parsed
     * are logged and skipped.
     */
    public static ConsumerOption fromConfig(final DynamicConfig config) {
        return builder -> {
            if (config == null) return;

            if (config.exist(GROUP)) {
                builder.apply(withGroupName(config.getString(GROUP)));
            }
            if (config.exist(NAME_SERVERS)) {
                builder.apply(withNameServer(ADDRESS_SPLITTER.splitToList(config.getString(NAME_SERVERS))));
            }
            if (config.exist(INSTANCE_NAME)) {
                builder.apply(withInstanceName(config.getString(INSTANCE_NAME)));
            }
            if (config.exist(NAMESPACE)) {
                builder.apply(withNamespace(config.getString(NAMESPACE)));
            }
            applyBoolean(builder, config, ACL_ENABLED, Options::withAcl);
            applyBoolean(builder, config, VIP_CHANNEL_ENABLED, Options::withVipChannel);
            applyBoolean(builder, config, ORDERLY, Options::withConsumeOrderly);
            applyBoolean(builder, config, POST_SUBSCRIPTION_WHEN_PULL, Options::withPostSubscriptionWhenPull);
            if (config.exist(CONSUME_TIMESTAMP)) {
                builder.apply(withConsumeTimestamp(config.getString(CONSUME_TIMESTAMP)));
            }

            if (config.exist(MODEL)) {
                final String name = config.getString(MODEL);
                final MessageModel model = MessageModel.parse(name);
                if (model == null) {
                    LOG.warn("ignore unknown consumer model. {}={}", MODEL, name);
                } else {
                    builder.apply(withConsumerModel(model));
                }
            }
            if (config.exist(FROM_WHERE)) {
                final String name = config.getString(FROM_WHERE);
                final ConsumeFromWhere where = ConsumeFromWhere.parse(name);
                if (where == null) {
                    LOG.warn("ignore unknown consume from where. {}={}", FROM_WHERE, name);
                } else {
                    builder.apply(withConsumeFromWhere(where));
                }
            }
            if (config.exist(ALLOCATE_STRATEGY)) {
                final String name = config.getString(ALLOCATE_STRATEGY);
                final AllocateStrategy strategy = AllocateStrategies.named(name);
                if (strategy == null) {
                    LOG.warn("ignore unknown allocate strategy. {}={}", ALLOCATE_STRATEGY, name);
                } else {
                    builder.apply(withStrategy(strategy));
                }
            }

            applyInt(builder, config, RETRY_TIMES, Options::withRetry);
            applyLong(builder, config, PULL_TIMEOUT_MILLIS, value -> withPullTimeout(value, TimeUnit.MILLISECONDS));
            applyInt(builder, config, CONSUME_CONCURRENTLY_MAX_SPAN, Options::withConsumeConcurrentlyMaxSpan);
            applyInt(builder, config, PULL_THRESHOLD_FOR_QUEUE, Options::withPullThresholdForQueue);
            applyLong(builder, config, PULL_THRESHOLD_SIZE_FOR_QUEUE, Options::withPullThresholdSizeForQueue);
            applyLong(builder, config, PULL_THRESHOLD_FOR_TOPIC, value -> withPullThresholdForTopic(value));
            applyLong(builder, config, PULL_THRESHOLD_SIZE_FOR_TOPIC, value -> withPullThresholdSizeForTopic(value));
            applyLong(builder, config, PULL_INTERVAL_MILLIS, value -> withPullInterval(value, TimeUnit.MILLISECONDS));
            applyInt(builder, config, CONSUME_MESSAGE_BATCH_MAX_SIZE, Options::withConsumeMessageBatchMaxSize);
            applyInt(builder, config, PULL_BATCH_SIZE, Options::withPullBatchSize);
            applyInt(builder, config, MAX_RECONSUME_TIMES, Options::withMaxReconsumeTimes);
            applyLong(builder, config, SUSPEND_CURRENT_QUEUE_TIME_MILLIS, value -> withSuspendCurrentQueueTime(value, TimeUnit.MILLISECONDS));
            applyLong(builder, config, CONSUME_TIMEOUT_MILLIS, value -> withConsumeTimeout(value, TimeUnit.MILLISECONDS));
        };
    }

    private static void applyLong(ConsumerOptions.Builder builder, DynamicConfig config, String key, LongOption option) {
        if (!config.exist(key)) return;

        final long value;
        try {
            value = config.getLong(key);
        } catch (NumberFormatException e) {
            LOG.warn("ignore invalid number. {}={}", key, config.getString(key, ""));
            return;
        }
        builder.apply(option.of(value));
    }

    private static void applyInt(ConsumerOptions.Builder builder, DynamicConfig config, String key, IntOption option) {
        if (!config.exist(key)) return;

        final int value;
        try {
            value = config.getInt(key);
        } catch (NumberFormatException e) {
            LOG.warn("ignore invalid or out of range int. {}={}", key, config.getString(key, ""));
            return;
        }
        builder.apply(option.of(value));
    }

    private static void applyBoolean(ConsumerOptions.Builder builder, DynamicConfig config, String key, BooleanOption option) {
        if (!config.exist(key)) return;

        final String value = config.getString(key).trim();
        if ("true".equalsIgnoreCase(value)) {
            builder.apply(option.of(true));
        } else if ("false".equalsIgnoreCase(value)) {
            builder.apply(option.of(false));
        } else {
            LOG.warn("ignore invalid boolean, expect true or false. {}={}", key, value);
        }
    }

    private interface LongOption {
        ConsumerOption of(long value);
    }

    private interface IntOption {
        ConsumerOption of(int value);
    }

    private interface BooleanOption {
        ConsumerOption of(boolean value);
    }
}
