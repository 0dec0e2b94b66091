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

package qunar.tc.qconsumer.configuration.local;

import qunar.tc.qconsumer.configuration.DynamicConfig;
import qunar.tc.qconsumer.configuration.DynamicConfigFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class LocalDynamicConfigFactory implements DynamicConfigFactory {
    private final ConcurrentMap<String, LocalDynamicConfig> configs = new ConcurrentHashMap<>();

    @Override
    public DynamicConfig create(final String name, final boolean failOnNotExist) {
        final LocalDynamicConfig existing = configs.get(name);
        if (existing != null) {
            return existing;
        }

        final LocalDynamicConfig created = new LocalDynamicConfig(name, failOnNotExist);
        final LocalDynamicConfig prev = configs.putIfAbsent(name, created);
        return prev == null ? created : prev;
    }
}
