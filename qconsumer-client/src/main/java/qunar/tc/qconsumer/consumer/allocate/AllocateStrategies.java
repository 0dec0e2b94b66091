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

import qunar.tc.qconsumer.AllocateStrategy;

import java.util.Locale;

/**
 * Lookup of the strategies that can be chosen by name in configuration.
 */
public final class AllocateStrategies {

    private AllocateStrategies() {
    }

    /**
     * @return a new strategy, or null when the name is unknown
     */
    public static AllocateStrategy named(String name) {
        if (name == null) return null;

        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case AllocateByAveragely.NAME:
                return new AllocateByAveragely();
            case AllocateByAveragelyCircle.NAME:
                return new AllocateByAveragelyCircle();
            default:
                return null;
        }
    }
}
