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

import com.google.common.base.Preconditions;

/**
 * A topic level cache limit, either unlimited or a positive bound.
 * <p>
 * The legacy encoding used by property files and older clients is a plain number where anything
 * {@code <= 0} means unlimited; {@link #fromLegacy(long)} and {@link #toLegacy()} convert at that boundary.
 */
public final class Threshold {
    private static final long UNLIMITED_VALUE = -1;

    private static final Threshold UNLIMITED = new Threshold(UNLIMITED_VALUE);

    private final long value;

    private Threshold(long value) {
        this.value = value;
    }

    public static Threshold unlimited() {
        return UNLIMITED;
    }

    public static Threshold limited(long value) {
        Preconditions.checkArgument(value > 0, "limited threshold must be positive: %s", value);
        return new Threshold(value);
    }

    public static Threshold fromLegacy(long value) {
        return value <= 0 ? UNLIMITED : new Threshold(value);
    }

    public boolean isLimited() {
        return value > 0;
    }

    /**
     * @throws IllegalStateException when unlimited
     */
    public long value() {
        Preconditions.checkState(isLimited(), "unlimited threshold has no value");
        return value;
    }

    public long toLegacy() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((Threshold) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isLimited() ? String.valueOf(value) : "unlimited";
    }
}
