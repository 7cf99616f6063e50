/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class SeiDatesTest {

    @Test
    void brazilianAndIsoFormats() {
        assertThat(SeiDates.parse("15/03/2024 10:30:05")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30, 5));
        assertThat(SeiDates.parse("2024-03-15 10:30:05")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30, 5));
        assertThat(SeiDates.parse("2024-03-15T10:30:05")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30, 5));
    }

    @Test
    void dateOnlyValuesStartTheDay() {
        assertThat(SeiDates.parse(" 15/03/2024 ")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(SeiDates.parse("2024-03-15")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
    }

    @Test
    void blankOrUnparseableIsNull() {
        assertThat(SeiDates.parse(null)).isNull();
        assertThat(SeiDates.parse("  ")).isNull();
        assertThat(SeiDates.parse("ontem")).isNull();
    }
}
