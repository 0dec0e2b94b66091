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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import qunar.tc.qconsumer.ConsumeFromWhere;
import qunar.tc.qconsumer.Interceptor;
import qunar.tc.qconsumer.MessageModel;
import qunar.tc.qconsumer.configuration.DynamicConfig;
import qunar.tc.qconsumer.configuration.DynamicConfigLoader;
import qunar.tc.qconsumer.configuration.MapDynamicConfig;
import qunar.tc.qconsumer.consumer.allocate.AllocateByAveragely;
import qunar.tc.qconsumer.consumer.allocate.AllocateByAveragelyCircle;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_CONSUMER_GROUP;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_NAME_SERVER;

@RunWith(MockitoJUnitRunner.class)
public class OptionsTest {

    @Mock
    private Interceptor a;

    @Mock
    private Interceptor b;

    @Mock
    private Interceptor c;

    private ConsumerOptions.Builder builder;

    @Before
    public void before() {
        builder = ConsumerOptions.defaults();
    }

    @Test
    public void testEmptyGroupNameIsIgnored() {
        builder.apply(Options.withGroupName(TEST_CONSUMER_GROUP), Options.withGroupName(""), Options.withGroupName(null));
        assertEquals(TEST_CONSUMER_GROUP, builder.getClientOptions().getGroupName());
    }

    @Test
    public void testEmptyNameServerIsIgnored() {
        builder.apply(Options.withNameServer(TEST_NAME_SERVER),
                Options.withNameServer(Collections.<String>emptyList()),
                Options.withNameServer(ImmutableList.of(" ", "")),
                Options.withNameServer((String[]) null));
        assertEquals(ImmutableList.of(TEST_NAME_SERVER), builder.getClientOptions().getNameServerAddrs());
    }

    @Test
    public void testNameServerEntriesAreTrimmed() {
        builder.apply(Options.withNameServer(" 10.0.0.1:9876 ", "", "10.0.0.2:9876"));
        assertEquals(ImmutableList.of("10.0.0.1:9876", "10.0.0.2:9876"), builder.getClientOptions().getNameServerAddrs());
    }

    @Test
    public void testNullValuesAreIgnored() {
        builder.apply(Options.withConsumerModel(MessageModel.CLUSTERING),
                Options.withConsumerModel(null),
                Options.withConsumeFromWhere(null),
                Options.withStrategy(null),
                Options.withPullThresholdForTopic((Threshold) null),
                Options.withConsumeTimestamp(""),
                Options.withPullTimeout(1, null),
                Options.withPullInterval(1, null),
                Options.withSuspendCurrentQueueTime(1, null),
                Options.withConsumeTimeout(1, null));

        assertEquals(MessageModel.CLUSTERING, builder.getConsumerModel());
        assertEquals(ConsumeFromWhere.CONSUME_FROM_LAST_OFFSET, builder.getFromWhere());
        assertTrue(builder.getAllocateStrategy() instanceof AllocateByAveragely);
        assertFalse(builder.getPullThresholdForTopic().isLimited());
        assertEquals(14, builder.getConsumeTimestamp().length());
        assertEquals(ConsumerOptions.DEFAULT_PULL_TIMEOUT_MILLIS, builder.getPullTimeoutMillis());
        assertEquals(0, builder.getPullIntervalMillis());
        assertEquals(ConsumerOptions.DEFAULT_SUSPEND_CURRENT_QUEUE_TIME_MILLIS, builder.getSuspendCurrentQueueTimeMillis());
        assertEquals(ConsumerOptions.DEFAULT_CONSUME_TIMEOUT_MILLIS, builder.getConsumeTimeoutMillis());
    }

    @Test
    public void testLastWriteWins() {
        builder.apply(Options.withGroupName("first"),
                Options.withPullBatchSize(16),
                Options.withGroupName("second"),
                Options.withPullBatchSize(64),
                Options.withAcl(true),
                Options.withAcl(false));

        assertEquals("second", builder.getClientOptions().getGroupName());
        assertEquals(64, builder.getPullBatchSize());
        assertFalse(builder.getClientOptions().build().isAclEnabled());
    }

    @Test
    public void testInterceptorsAppendInOrder() {
        builder.apply(Options.withInterceptor(a), Options.withInterceptor(b, c));
        assertEquals(ImmutableList.of(a, b, c), builder.getInterceptors());
    }

    @Test
    public void testChainAppliesInOrder() {
        builder.apply(Options.chain(Options.withRetry(1), Options.withRetry(7)));
        assertEquals(7, builder.getClientOptions().getRetryTimes());
    }

    @Test
    public void testMaxReconsumeTimes() {
        builder.apply(Options.withMaxReconsumeTimes(-1));
        assertTrue(builder.getMaxReconsumeTimes().isDefault());
        assertEquals(16, builder.getMaxReconsumeTimes().resolve());

        builder.apply(Options.withMaxReconsumeTimes(5));
        assertEquals(5, builder.getMaxReconsumeTimes().resolve());

        builder.apply(Options.withMaxReconsumeTimes(0));
        assertEquals(0, builder.getMaxReconsumeTimes().resolve());
    }

    @Test
    public void testDurationsStoredAsMillis() {
        builder.apply(Options.withPullTimeout(3, TimeUnit.SECONDS),
                Options.withPullInterval(20, TimeUnit.MILLISECONDS),
                Options.withSuspendCurrentQueueTime(2, TimeUnit.SECONDS),
                Options.withConsumeTimeout(1, TimeUnit.MINUTES));

        assertEquals(3000, builder.getPullTimeoutMillis());
        assertEquals(20, builder.getPullIntervalMillis());
        assertEquals(2000, builder.getSuspendCurrentQueueTimeMillis());
        assertEquals(60000, builder.getConsumeTimeoutMillis());
    }

    @Test
    public void testLegacyTopicThresholds() {
        builder.apply(Options.withPullThresholdForTopic(1000), Options.withPullThresholdSizeForTopic(-1));
        assertEquals(Threshold.limited(1000), builder.getPullThresholdForTopic());
        assertEquals(Threshold.unlimited(), builder.getPullThresholdSizeForTopic());

        builder.apply(Options.withPullThresholdForTopic(0));
        assertFalse(builder.getPullThresholdForTopic().isLimited());
    }

    @Test
    public void testFromConfigFile() throws Exception {
        ConsumerOptions options = ConsumerOptions.create(Options.fromConfig(DynamicConfigLoader.CONSUMER_CONFIG));

        assertEquals("order_consumer", options.getGroupName());
        assertEquals(ImmutableList.of("10.0.0.1:9876", "10.0.0.2:9876"), options.getNameServerAddrs());
        assertEquals(MessageModel.CLUSTERING, options.getConsumerModel());
        assertEquals(ConsumeFromWhere.CONSUME_FROM_TIMESTAMP, options.getFromWhere());
        assertEquals("20131223171201", options.getConsumeTimestamp());
        assertTrue(options.getAllocateStrategy() instanceof AllocateByAveragelyCircle);
        assertEquals(Threshold.limited(1000), options.getPullThresholdForTopic());
        assertFalse(options.getPullThresholdSizeForTopic().isLimited());
        assertEquals(64, options.getPullBatchSize());
        assertEquals(5, options.getMaxReconsumeTimes());
        assertEquals(100, options.getPullIntervalMillis());
        assertEquals(60000, options.getConsumeTimeoutMillis());
    }

    @Test
    public void testFromMissingConfigFileIsNoop() {
        builder.apply(Options.withGroupName(TEST_CONSUMER_GROUP),
                Options.fromConfig("no-such-consumer.properties"),
                Options.fromConfig(""));

        assertEquals(TEST_CONSUMER_GROUP, builder.getClientOptions().getGroupName());
        assertEquals(null, builder.getConsumerModel());
    }

    @Test
    public void testFromConfigSkipsIntOverflow() {
        DynamicConfig config = new MapDynamicConfig(ImmutableMap.of(
                ConsumerConfigKeys.PULL_BATCH_SIZE, "4294967328",
                ConsumerConfigKeys.MAX_RECONSUME_TIMES, "4294967295",
                ConsumerConfigKeys.PULL_THRESHOLD_FOR_QUEUE, "2147483648",
                ConsumerConfigKeys.RETRY_TIMES, "5"));

        builder.apply(Options.withMaxReconsumeTimes(3), Options.fromConfig(config));

        assertEquals(ConsumerOptions.DEFAULT_PULL_BATCH_SIZE, builder.getPullBatchSize());
        assertEquals(3, builder.getMaxReconsumeTimes().resolve());
        assertEquals(ConsumerOptions.DEFAULT_PULL_THRESHOLD_FOR_QUEUE, builder.getPullThresholdForQueue());
        assertEquals(5, builder.getClientOptions().getRetryTimes());
    }

    @Test
    public void testFromConfigBooleans() {
        builder.apply(Options.withConsumeOrderly(true), Options.withVipChannel(true));
        DynamicConfig config = new MapDynamicConfig(ImmutableMap.of(
                ConsumerConfigKeys.ORDERLY, "yes",
                ConsumerConfigKeys.VIP_CHANNEL_ENABLED, "FALSE",
                ConsumerConfigKeys.POST_SUBSCRIPTION_WHEN_PULL, " true "));

        builder.apply(Options.fromConfig(config));

        assertTrue(builder.isConsumeOrderly());
        assertFalse(builder.getClientOptions().build().isVipChannelEnabled());
        assertTrue(builder.isPostSubscriptionWhenPull());
    }

    @Test
    public void testFromConfigSkipsInvalidValues() {
        DynamicConfig config = new MapDynamicConfig(ImmutableMap.of(
                ConsumerConfigKeys.MODEL, "unknown",
                ConsumerConfigKeys.ALLOCATE_STRATEGY, "nope",
                ConsumerConfigKeys.PULL_BATCH_SIZE, "many",
                ConsumerConfigKeys.CONSUME_MESSAGE_BATCH_MAX_SIZE, "8"));

        builder.apply(Options.fromConfig(config));

        assertEquals(null, builder.getConsumerModel());
        assertTrue(builder.getAllocateStrategy() instanceof AllocateByAveragely);
        assertEquals(ConsumerOptions.DEFAULT_PULL_BATCH_SIZE, builder.getPullBatchSize());
        assertEquals(8, builder.getConsumeMessageBatchMaxSize());
    }

    @Test
    public void testFromConfigLeavesAbsentKeysUntouched() {
        builder.apply(Options.withGroupName(TEST_CONSUMER_GROUP), Options.withPullBatchSize(100));
        builder.apply(Options.fromConfig(new MapDynamicConfig(Collections.<String, String>emptyMap())));

        assertEquals(TEST_CONSUMER_GROUP, builder.getClientOptions().getGroupName());
        assertEquals(100, builder.getPullBatchSize());
    }

    @Test
    public void testStrategyOption() {
        AllocateByAveragelyCircle strategy = new AllocateByAveragelyCircle();
        builder.apply(Options.withStrategy(strategy));
        assertSame(strategy, builder.getAllocateStrategy());
    }
}
