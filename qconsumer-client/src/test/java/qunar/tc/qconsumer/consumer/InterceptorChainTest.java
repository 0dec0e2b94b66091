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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import qunar.tc.qconsumer.ConsumeInvoker;
import qunar.tc.qconsumer.ConsumeRequest;
import qunar.tc.qconsumer.ConsumeResult;
import qunar.tc.qconsumer.Interceptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static qunar.tc.qconsumer.ClientTestUtils.getConsumeRequest;

@RunWith(MockitoJUnitRunner.class)
public class InterceptorChainTest {

    @Mock
    private Interceptor a;

    @Mock
    private Interceptor b;

    @Mock
    private Interceptor c;

    @Mock
    private ConsumeInvoker invoker;

    private final ConsumeRequest request = getConsumeRequest(3);

    @Test
    public void testWrapsInAppendOrder() throws Exception {
        when(a.preConsume(eq(request), anyMap())).thenReturn(true);
        when(b.preConsume(eq(request), anyMap())).thenReturn(true);
        when(c.preConsume(eq(request), anyMap())).thenReturn(true);
        when(invoker.invoke(request)).thenReturn(ConsumeResult.SUCCESS);

        InterceptorChain chain = InterceptorChain.empty().append(a).append(b, c);
        ConsumeResult result = chain.invoke(request, invoker);

        assertEquals(ConsumeResult.SUCCESS, result);
        InOrder order = inOrder(a, b, c, invoker);
        order.verify(a).preConsume(eq(request), anyMap());
        order.verify(b).preConsume(eq(request), anyMap());
        order.verify(c).preConsume(eq(request), anyMap());
        order.verify(invoker).invoke(request);
        order.verify(c).postConsume(eq(request), eq(ConsumeResult.SUCCESS), isNull(), anyMap());
        order.verify(b).postConsume(eq(request), eq(ConsumeResult.SUCCESS), isNull(), anyMap());
        order.verify(a).postConsume(eq(request), eq(ConsumeResult.SUCCESS), isNull(), anyMap());
    }

    @Test
    public void testVetoSkipsRestOfChain() throws Exception {
        when(a.preConsume(eq(request), anyMap())).thenReturn(true);
        when(b.preConsume(eq(request), anyMap())).thenReturn(false);

        ConsumeResult result = InterceptorChain.empty().append(a, b, c).invoke(request, invoker);

        assertEquals(ConsumeResult.SUCCESS, result);
        verify(c, never()).preConsume(any(ConsumeRequest.class), anyMap());
        verify(invoker, never()).invoke(any(ConsumeRequest.class));
        verify(c, never()).postConsume(any(ConsumeRequest.class), any(), any(), anyMap());

        InOrder order = inOrder(a, b);
        order.verify(b).postConsume(eq(request), eq(ConsumeResult.SUCCESS), isNull(), anyMap());
        order.verify(a).postConsume(eq(request), eq(ConsumeResult.SUCCESS), isNull(), anyMap());
    }

    @Test
    public void testInvokerErrorReachesPostHooksAndIsRethrown() throws Exception {
        RuntimeException error = new RuntimeException("consume failed");
        when(a.preConsume(eq(request), anyMap())).thenReturn(true);
        when(b.preConsume(eq(request), anyMap())).thenReturn(true);
        when(invoker.invoke(request)).thenThrow(error);

        try {
            InterceptorChain.empty().append(a, b).invoke(request, invoker);
            fail("expected exception");
        } catch (RuntimeException e) {
            assertSame(error, e);
        }

        InOrder order = inOrder(a, b);
        order.verify(b).postConsume(eq(request), isNull(), eq(error), anyMap());
        order.verify(a).postConsume(eq(request), isNull(), eq(error), anyMap());
    }

    @Test
    public void testFailingPostHookDoesNotStopOthers() throws Exception {
        when(a.preConsume(eq(request), anyMap())).thenReturn(true);
        when(b.preConsume(eq(request), anyMap())).thenReturn(true);
        when(invoker.invoke(request)).thenReturn(ConsumeResult.RETRY_LATER);
        doThrow(new IllegalStateException("post failed"))
                .when(b).postConsume(eq(request), eq(ConsumeResult.RETRY_LATER), isNull(), anyMap());

        ConsumeResult result = InterceptorChain.empty().append(a, b).invoke(request, invoker);

        assertEquals(ConsumeResult.RETRY_LATER, result);
        verify(a).postConsume(eq(request), eq(ConsumeResult.RETRY_LATER), isNull(), anyMap());
    }

    @Test
    public void testContextSharedAcrossHooks() throws Exception {
        final List<String> events = new ArrayList<>();
        Interceptor timer = new RecordingInterceptor("outer", events) {
            @Override
            public boolean preConsume(ConsumeRequest request, Map<String, Object> context) {
                context.put("start", 42L);
                return super.preConsume(request, context);
            }
        };
        Interceptor reader = new RecordingInterceptor("inner", events) {
            @Override
            public void postConsume(ConsumeRequest request, ConsumeResult result, Throwable e, Map<String, Object> context) {
                events.add("start=" + context.get("start"));
                super.postConsume(request, result, e, context);
            }
        };

        InterceptorChain.empty().append(timer, reader).invoke(request, r -> {
            events.add("invoke");
            return ConsumeResult.SUCCESS;
        });

        assertEquals("[pre:outer, pre:inner, invoke, start=42, post:inner, post:outer]", events.toString());
    }

    @Test
    public void testAppendIsAdditiveAndImmutable() {
        InterceptorChain first = InterceptorChain.empty().append(a);
        InterceptorChain second = first.append(a, b);

        assertEquals(1, first.size());
        assertEquals(3, second.size());
        assertSame(a, second.getInterceptors().get(0));
        assertSame(a, second.getInterceptors().get(1));
        assertSame(b, second.getInterceptors().get(2));
        assertTrue(InterceptorChain.empty().isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testInterceptorsCannotBeRemoved() {
        InterceptorChain.empty().append(a).getInterceptors().remove(0);
    }

    private static class RecordingInterceptor implements Interceptor {
        private final String name;
        private final List<String> events;

        RecordingInterceptor(String name, List<String> events) {
            this.name = name;
            this.events = events;
        }

        @Override
        public boolean preConsume(ConsumeRequest request, Map<String, Object> context) {
            events.add("pre:" + name);
            return true;
        }

        @Override
        public void postConsume(ConsumeRequest request, ConsumeResult result, Throwable e, Map<String, Object> context) {
            events.add("post:" + name);
        }
    }
}
