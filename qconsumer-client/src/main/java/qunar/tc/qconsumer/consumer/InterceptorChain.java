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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.ConsumeInvoker;
import qunar.tc.qconsumer.ConsumeRequest;
import qunar.tc.qconsumer.ConsumeResult;
import qunar.tc.qconsumer.Interceptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, append only list of interceptors. The first appended interceptor is the outer most wrapper.
 */
public final class InterceptorChain {
    private static final Logger LOGGER = LoggerFactory.getLogger(InterceptorChain.class);

    private static final InterceptorChain EMPTY = new InterceptorChain(ImmutableList.<Interceptor>of());

    private final ImmutableList<Interceptor> interceptors;

    private InterceptorChain(ImmutableList<Interceptor> interceptors) {
        this.interceptors = interceptors;
    }

    public static InterceptorChain empty() {
        return EMPTY;
    }

    public static InterceptorChain of(List<Interceptor> interceptors) {
        return EMPTY.append(interceptors);
    }

    public InterceptorChain append(Interceptor... more) {
        if (more == null) return this;

        final ImmutableList.Builder<Interceptor> builder = ImmutableList.builder();
        builder.addAll(interceptors);
        for (Interceptor interceptor : more) {
            if (interceptor != null) {
                builder.add(interceptor);
            }
        }
        return new InterceptorChain(builder.build());
    }

    public InterceptorChain append(List<Interceptor> more) {
        return append(more.toArray(new Interceptor[0]));
    }

    public List<Interceptor> getInterceptors() {
        return interceptors;
    }

    public int size() {
        return interceptors.size();
    }

    public boolean isEmpty() {
        return interceptors.isEmpty();
    }

    /**
     * Runs every pre hook in order, then {@code invoker}, then the post hooks of every interceptor whose pre
     * hook ran, in reverse order. A pre hook returning false skips the remaining pre hooks and the invoker.
     * Exceptions from a pre hook or the invoker reach the post hooks and are then rethrown.
     */
    public ConsumeResult invoke(final ConsumeRequest request, final ConsumeInvoker invoker) throws Exception {
        final Map<String, Object> context = new HashMap<>();
        int processedIndex = -1;
        ConsumeResult result = null;
        Throwable error = null;
        try {
            for (int i = 0; i < interceptors.size(); ++i) {
                processedIndex = i;
                if (!interceptors.get(i).preConsume(request, context)) {
                    result = ConsumeResult.SUCCESS;
                    return result;
                }
            }
            result = invoker.invoke(request);
            return result;
        } catch (Exception | Error e) {
            error = e;
            throw e;
        } finally {
            applyPostConsume(processedIndex, request, result, error, context);
        }
    }

    private void applyPostConsume(int processedIndex, ConsumeRequest request, ConsumeResult result, Throwable error, Map<String, Object> context) {
        for (int i = processedIndex; i >= 0; --i) {
            try {
                interceptors.get(i).postConsume(request, result, error, context);
            } catch (Throwable e) {
                LOGGER.error("post interceptor failed. interceptor={}, request={}", interceptors.get(i), request, e);
            }
        }
    }

    @Override
    public String toString() {
        return "InterceptorChain" + interceptors;
    }
}
