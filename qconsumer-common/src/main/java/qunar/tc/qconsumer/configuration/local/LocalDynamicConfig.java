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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qunar.tc.qconsumer.configuration.AbstractDynamicConfig;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Properties file read once when loaded. Looked up in the directory named by the {@code qconsumer.conf}
 * system property first, then on the classpath.
 * <p>
 * Consumer options are frozen once built, so the file is not watched for changes.
 */
public class LocalDynamicConfig extends AbstractDynamicConfig {
    private static final Logger LOG = LoggerFactory.getLogger(LocalDynamicConfig.class);

    static final String CONF_DIR_PROPERTY = "qconsumer.conf";

    private final String name;
    private final Map<String, String> config;

    LocalDynamicConfig(String name, boolean failOnNotExist) {
        this.name = name;
        this.config = load(name, failOnNotExist);
    }

    private static Map<String, String> load(final String name, final boolean failOnNotExist) {
        final Properties p = new Properties();
        try (InputStream in = open(name)) {
            if (in == null) {
                if (failOnNotExist) {
                    throw new RuntimeException("cannot find config file " + name);
                }
                LOG.info("config file {} not found, use empty config", name);
                return Collections.emptyMap();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                p.load(reader);
            }
        } catch (IOException e) {
            throw new RuntimeException("load config file failed. config: " + name, e);
        }

        final Map<String, String> map = new LinkedHashMap<>(p.size());
        for (String key : p.stringPropertyNames()) {
            map.put(key, tryTrim(p.getProperty(key)));
        }
        return Collections.unmodifiableMap(map);
    }

    private static InputStream open(final String name) throws IOException {
        final String confDir = System.getProperty(CONF_DIR_PROPERTY);
        if (confDir != null && confDir.length() > 0) {
            final File file = new File(confDir, name);
            return file.exists() ? new FileInputStream(file) : null;
        }
        return LocalDynamicConfig.class.getClassLoader().getResourceAsStream(name);
    }

    private static String tryTrim(String data) {
        if (data == null) {
            return null;
        } else {
            return data.trim();
        }
    }

    @Override
    protected String getValue(String key) {
        return config.get(key);
    }

    @Override
    public Map<String, String> asMap() {
        return config;
    }

    @Override
    public String toString() {
        return "LocalDynamicConfig{name='" + name + "'}";
    }
}
