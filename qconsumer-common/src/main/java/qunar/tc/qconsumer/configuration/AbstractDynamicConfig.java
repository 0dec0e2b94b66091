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

import com.google.common.base.Strings;

/**
 * Typed getters over a raw string lookup.
 */
public abstract class AbstractDynamicConfig implements DynamicConfig {

    protected abstract String getValue(String name);

    private String getValueWithCheck(final String name) {
        final String value = getValue(name);
        if (value == null) {
            throw new RuntimeException("cannot find config " + name);
        }
        return value;
    }

    @Override
    public String getString(String name) {
        return getValueWithCheck(name);
    }

    @Override
    public String getString(String name, String defaultValue) {
        String value = getValue(name);
        if (isBlank(value))
            return defaultValue;
        return value;
    }

    @Override
    public int getInt(String name) {
        return Integer.parseInt(getValueWithCheck(name).trim());
    }

    @Override
    public int getInt(String name, int defaultValue) {
        String value = getValue(name);
        if (isBlank(value))
            return defaultValue;
        return Integer.parseInt(value.trim());
    }

    @Override
    public long getLong(String name) {
        return Long.parseLong(getValueWithCheck(name).trim());
    }

    @Override
    public long getLong(String name, long defaultValue) {
        String value = getValue(name);
        if (isBlank(value))
            return defaultValue;
        return Long.parseLong(value.trim());
    }

    @Override
    public boolean getBoolean(String name, boolean defaultValue) {
        String value = getValue(name);
        if (isBlank(value))
            return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    @Override
    public boolean exist(String name) {
        return !isBlank(getValue(name));
    }

    private static boolean isBlank(final String s) {
        return Strings.isNullOrEmpty(s) || s.trim().isEmpty();
    }
}
