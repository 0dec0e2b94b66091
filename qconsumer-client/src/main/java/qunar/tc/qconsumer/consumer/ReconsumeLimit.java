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

/**
 * How many times a failed message is redelivered before it goes to the dead letter queue.
 * Unless set explicitly the broker side default of {@value #DEFAULT_MAX_RECONSUME_TIMES} applies.
 */
public final class ReconsumeLimit {
    public static final int DEFAULT_MAX_RECONSUME_TIMES = 16;

    private static final int LEGACY_DEFAULT = -1;

    private static final ReconsumeLimit DEFAULT = new ReconsumeLimit(true, LEGACY_DEFAULT);

    private final boolean useDefault;
    private final int times;

    private ReconsumeLimit(boolean useDefault, int times) {
        this.useDefault = useDefault;
        this.times = times;
    }

    public static ReconsumeLimit useDefault() {
        return DEFAULT;
    }

    public static ReconsumeLimit of(int times) {
        return new ReconsumeLimit(false, times);
    }

    /**
     * {@code -1} is the legacy spelling of the default.
     */
    public static ReconsumeLimit fromLegacy(int times) {
        return times == LEGACY_DEFAULT ? DEFAULT : of(times);
    }

    public boolean isDefault() {
        return useDefault;
    }

    public int resolve() {
        return useDefault ? DEFAULT_MAX_RECONSUME_TIMES : times;
    }

    public int toLegacy() {
        return useDefault ? LEGACY_DEFAULT : times;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReconsumeLimit that = (ReconsumeLimit) o;
        return useDefault == that.useDefault && times == that.times;
    }

    @Override
    public int hashCode() {
        return useDefault ? 0 : 31 + times;
    }

    @Override
    public String toString() {
        return useDefault ? "default(" + DEFAULT_MAX_RECONSUME_TIMES + ")" : String.valueOf(times);
    }
}
