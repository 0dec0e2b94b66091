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

package qunar.tc.qconsumer.utils;

import com.google.common.base.Strings;

import java.text.ParsePosition;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Second precision timestamps in the {@code yyyyMMddHHmmss} form, e.g. 20131223171201.
 */
public final class ConsumeTimestamps {
    public static final String PATTERN = "yyyyMMddHHmmss";

    private static final ThreadLocal<SimpleDateFormat> FORMATTER = ThreadLocal.withInitial(() -> {
        final SimpleDateFormat format = new SimpleDateFormat(PATTERN);
        format.setLenient(false);
        return format;
    });

    private ConsumeTimestamps() {
    }

    public static String format(long timestampMillis) {
        return FORMATTER.get().format(new Date(timestampMillis));
    }

    /**
     * @return the default backtracking point, half an hour before {@code nowMillis}
     */
    public static String halfHourBefore(long nowMillis) {
        return format(nowMillis - TimeUnit.MINUTES.toMillis(30));
    }

    /**
     * @return millis since epoch, or null when {@code timestamp} is not a complete valid timestamp
     */
    public static Long parse(String timestamp) {
        if (Strings.isNullOrEmpty(timestamp) || timestamp.length() != PATTERN.length()) return null;

        final ParsePosition position = new ParsePosition(0);
        final Date date = FORMATTER.get().parse(timestamp, position);
        if (date == null || position.getIndex() != timestamp.length()) return null;
        return date.getTime();
    }

    public static boolean isValid(String timestamp) {
        return parse(timestamp) != null;
    }
}
