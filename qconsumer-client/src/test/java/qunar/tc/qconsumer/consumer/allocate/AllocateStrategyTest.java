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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.junit.Test;
import qunar.tc.qconsumer.AllocateStrategy;
import qunar.tc.qconsumer.MessageQueue;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_BROKER;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_CLIENT_ID_1;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_CLIENT_ID_2;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_CLIENT_ID_3;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_CONSUMER_GROUP;
import static qunar.tc.qconsumer.ClientTestUtils.TEST_TOPIC;
import static qunar.tc.qconsumer.ClientTestUtils.getQueues;

public class AllocateStrategyTest {
    private static final List<String> CLIENTS = ImmutableList.of(TEST_CLIENT_ID_1, TEST_CLIENT_ID_2, TEST_CLIENT_ID_3);

    private static MessageQueue queue(int id) {
        return new MessageQueue(TEST_TOPIC, TEST_BROKER, id);
    }

    private static void assertPartition(AllocateStrategy strategy, List<MessageQueue> queues) {
        Set<MessageQueue> seen = Sets.newHashSet();
        int total = 0;
        for (String client : CLIENTS) {
            List<MessageQueue> owned = strategy.allocate(TEST_CONSUMER_GROUP, client, queues, CLIENTS);
            total += owned.size();
            seen.addAll(owned);
        }
        assertEquals(queues.size(), total);
        assertEquals(Sets.newHashSet(queues), seen);
    }

    @Test
    public void testAveragelySplitsContiguousRanges() {
        AllocateByAveragely strategy = new AllocateByAveragely();
        List<MessageQueue> queues = getQueues(8);

        assertEquals(ImmutableList.of(queue(0), queue(1), queue(2)),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_1, queues, CLIENTS));
        assertEquals(ImmutableList.of(queue(3), queue(4), queue(5)),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_2, queues, CLIENTS));
        assertEquals(ImmutableList.of(queue(6), queue(7)),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_3, queues, CLIENTS));
        assertPartition(strategy, queues);
    }

    @Test
    public void testCircleDealsRoundRobin() {
        AllocateByAveragelyCircle strategy = new AllocateByAveragelyCircle();
        List<MessageQueue> queues = getQueues(8);

        assertEquals(ImmutableList.of(queue(0), queue(3), queue(6)),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_1, queues, CLIENTS));
        assertEquals(ImmutableList.of(queue(2), queue(5)),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_3, queues, CLIENTS));
        assertPartition(strategy, queues);
    }

    @Test
    public void testMoreClientsThanQueues() {
        AllocateByAveragely strategy = new AllocateByAveragely();
        List<MessageQueue> queues = getQueues(2);

        assertEquals(ImmutableList.of(queue(0)), strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_1, queues, CLIENTS));
        assertEquals(ImmutableList.of(queue(1)), strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_2, queues, CLIENTS));
        assertTrue(strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_3, queues, CLIENTS).isEmpty());
        assertTrue(new AllocateByAveragelyCircle().allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_3, queues, CLIENTS).isEmpty());
    }

    @Test
    public void testInputOrderDoesNotMatter() {
        AllocateByAveragely strategy = new AllocateByAveragely();
        List<MessageQueue> shuffled = Lists.newArrayList(getQueues(8));
        Collections.reverse(shuffled);
        List<String> clients = Lists.reverse(CLIENTS);

        assertEquals(strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_2, getQueues(8), CLIENTS),
                strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_2, shuffled, clients));
    }

    @Test
    public void testUnknownClientGetsNothing() {
        assertTrue(new AllocateByAveragely().allocate(TEST_CONSUMER_GROUP, "10.0.0.9@DEFAULT", getQueues(8), CLIENTS).isEmpty());
        assertTrue(new AllocateByAveragely().allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_1, getQueues(0), CLIENTS).isEmpty());
        assertTrue(new AllocateByAveragely().allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_1, null, CLIENTS).isEmpty());
    }

    @Test
    public void testConfigReturnsFixedQueues() {
        List<MessageQueue> fixed = ImmutableList.of(queue(1), queue(4));
        AllocateByConfig strategy = new AllocateByConfig(fixed);

        assertEquals(fixed, strategy.allocate(TEST_CONSUMER_GROUP, TEST_CLIENT_ID_3, getQueues(8), CLIENTS));
        assertEquals(AllocateByConfig.NAME, strategy.getName());
    }

    @Test
    public void testNamed() {
        assertTrue(AllocateStrategies.named("avg") instanceof AllocateByAveragely);
        assertTrue(AllocateStrategies.named(" AVG_BY_CIRCLE ") instanceof AllocateByAveragelyCircle);
        assertNull(AllocateStrategies.named("CONFIG"));
        assertNull(AllocateStrategies.named(null));
    }
}
