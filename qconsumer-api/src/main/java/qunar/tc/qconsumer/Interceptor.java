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

import java.util.Map;

/**
 * Cross-cutting hook around a consumption invocation.
 * <p>
 * Interceptors run in the order they were registered on the way in and in reverse order on the way out,
 * so the first registered interceptor is the outer most wrapper around the listener.
 */
public interface Interceptor {

    /**
     * 在消费逻辑之前执行
     *
     * @param request 本次消费的消息批次，建议不要修改消息内容
     * @param context 可以在这里保存一些上下文, 同一次调用中所有interceptor共享
     * @return 如果返回true则interceptor链继续往下执行，只要任一interceptor返回false，则后续的
     * interceptor不会执行，并且消费逻辑也不会执行
     */
    boolean preConsume(ConsumeRequest request, Map<String, Object> context);

    /**
     * 在消费逻辑之后执行，可以做一些资源清理工作. 只有preConsume被调用过的interceptor才会执行
     *
     * @param request 本次消费的消息批次
     * @param result  消费结果, 消费逻辑抛出异常时为null
     * @param e       interceptor链和消费逻辑抛出的异常
     * @param context 上下文
     */
    void postConsume(ConsumeRequest request, ConsumeResult result, Throwable e, Map<String, Object> context);
}
