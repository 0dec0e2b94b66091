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

package qunar.tc.qconsumer.configuration;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * In-memory configuration, for consumers that assemble their settings in code.
 */
public class MapDynamicConfig extends AbstractDynamicConfig {
    private final Map<String, String> config;

    public MapDynamicConfig(Map<String, String> config) {
        this.config = ImmutableMap.copyOf(config);
    }

    @Override
    protected String getValue(String name) {
        return config.get(name);
    }

    @Override
    public Map<String, String> asMap() {
        return config;
    }

    @Override
    public String toString() {
        return "MapDynamicConfig" + config;
    }
}
