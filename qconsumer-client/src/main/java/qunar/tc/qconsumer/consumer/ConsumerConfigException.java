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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Raised once by {@link ConsumerOptions.Builder#build()} with every problem found in the assembled options.
 * A consumer must not start with options that failed to build.
 */
public class ConsumerConfigException extends Exception {
    private static final long serialVersionUID = 2301488361706281839L;

    private final List<String> problems;

    public ConsumerConfigException(List<String> problems) {
        super("invalid consumer options: " + Joiner.on("; ").join(problems));
        this.problems = ImmutableList.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
