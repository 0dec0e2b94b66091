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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.configuration.local.LocalDynamicConfigFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Loads consumer configuration files by name.
 * <p>
 * A {@link DynamicConfigFactory} registered under {@code META-INF/services} takes over when present,
 * otherwise files are read by {@link LocalDynamicConfigFactory}. The factory is resolved on first use.
 */
public final class DynamicConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DynamicConfigLoader.class);

    public static final String CONSUMER_CONFIG = "consumer.properties";

    private DynamicConfigLoader() {
    }

    public static DynamicConfig load(final String name) {
        return load(name, true);
    }

    public static DynamicConfig load(final String name, final boolean failOnNotExist) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "config name is empty");
        return FactoryHolder.FACTORY.create(name, failOnNotExist);
    }

    static DynamicConfigFactory factory() {
        return FactoryHolder.FACTORY;
    }

    private static DynamicConfigFactory resolveFactory() {
        final Iterator<DynamicConfigFactory> factories = ServiceLoader.load(DynamicConfigFactory.class).iterator();
        if (factories.hasNext()) {
            final DynamicConfigFactory factory = factories.next();
            LOG.info("consumer config is loaded by {}", factory.getClass().getName());
            return factory;
        }
        return new LocalDynamicConfigFactory();
    }

    private static final class FactoryHolder {
        private static final DynamicConfigFactory FACTORY = resolveFactory();
    }
}
