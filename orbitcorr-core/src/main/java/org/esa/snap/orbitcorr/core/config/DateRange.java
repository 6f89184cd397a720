/*
 * Copyright (c) 2026.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.esa.snap.orbitcorr.core.config;

import org.esa.snap.orbitcorr.core.OrbitCorrException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive processing date range, days formatted as yyyyMMdd.
 */
public final class DateRange {

    public static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final LocalDate start;
    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new OrbitCorrException("End date " + format(end) + " is before start date " + format(start));
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange parse(String start, String end) {
        return new DateRange(parseDay(start), parseDay(end));
    }

    public static LocalDate parseDay(String day) {
        try {
            return LocalDate.parse(day.trim(), DAY_FORMAT);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new OrbitCorrException("Invalid date '" + day + "', expected yyyyMMdd", e);
        }
    }

    public static String format(LocalDate day) {
        return day.format(DAY_FORMAT);
    }

    /**
     * Splits the range into the part before the switch day and the part from the switch day on,
     * if the switch day lies after the start and not after the end.
     *
     * @param switchDay - first day of the second part
     * @return the two parts, or this range alone
     */
    public List<DateRange> splitAround(LocalDate switchDay) {
        if (start.isBefore(switchDay) && !end.isBefore(switchDay)) {
            return Arrays.asList(new DateRange(start, switchDay.minusDays(1)), new DateRange(switchDay, end));
        }
        return Collections.singletonList(this);
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DateRange that = (DateRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return format(start) + "-" + format(end);
    }
}
