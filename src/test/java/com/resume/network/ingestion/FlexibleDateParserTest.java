package com.resume.network.ingestion;

import com.resume.network.ingestion.FlexibleDateParser.ParsedDate;
import com.resume.network.ingestion.FlexibleDateParser.ParsedRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FlexibleDateParser Tests")
class FlexibleDateParserTest {

    private final FlexibleDateParser parser = new FlexibleDateParser();

    @Nested
    @DisplayName("Single dates")
    class SingleDateTests {

        @ParameterizedTest
        @CsvSource({
                "'Jan 2019', 2019-01-01",
                "'January 2019', 2019-01-01",
                "'Sept. 2020', 2020-09-01",
                "'03/2018', 2018-03-01",
                "'2018-03', 2018-03-01",
                "'2018-03-15', 2018-03-15",
                "'7/4/2016', 2016-07-04",
                "'2017', 2017-01-01",
                "'since 2015', 2015-01-01",
                "'(2014)', 2014-01-01"
        })
        @DisplayName("Should parse common resume date formats")
        void testParse(String text, String expected) {
            ParsedDate parsed = parser.parse(text);

            assertTrue(parsed.recognized());
            assertEquals(LocalDate.parse(expected), parsed.date());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Present", "current", "NOW", "till date"})
        @DisplayName("Should recognize open-ended markers")
        void testOpenEnded(String text) {
            ParsedDate parsed = parser.parse(text);

            assertTrue(parsed.openEnded());
            assertNull(parsed.date());
            assertTrue(parsed.isPresent());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Summer of discontent", "Summer 2019", "13/2020", "1850"})
        @DisplayName("Unparseable text yields a null date, not an exception")
        void testUnparseable(String text) {
            ParsedDate parsed = parser.parse(text);

            assertFalse(parsed.recognized());
            assertNull(parsed.date());
            assertEquals(text, parsed.raw());
        }

        @Test
        @DisplayName("Blank text is missing")
        void testMissing() {
            ParsedDate parsed = parser.parse("  ");

            assertFalse(parsed.isPresent());
            assertTrue(parsed.recognized());
        }
    }

    @Nested
    @DisplayName("Ranges")
    class RangeTests {

        @Test
        @DisplayName("Should split an en-dash range with an open end")
        void testEnDashRange() {
            ParsedRange range = parser.parseRange("Jan 2019 – Present");

            assertEquals(LocalDate.of(2019, 1, 1), range.start().date());
            assertTrue(range.end().openEnded());
        }

        @Test
        @DisplayName("Should split a bare hyphen between years")
        void testBareHyphenRange() {
            ParsedRange range = parser.parseRange("2019-2021");

            assertEquals(LocalDate.of(2019, 1, 1), range.start().date());
            assertEquals(LocalDate.of(2021, 1, 1), range.end().date());
        }

        @Test
        @DisplayName("Should split a 'to' range")
        void testToRange() {
            ParsedRange range = parser.parseRange("03/2017 to 06/2019");

            assertEquals(LocalDate.of(2017, 3, 1), range.start().date());
            assertEquals(LocalDate.of(2019, 6, 1), range.end().date());
        }

        @Test
        @DisplayName("Should record the precision each end was written at")
        void testPrecision() {
            ParsedRange years = parser.parseRange("2019 - 2019");
            ParsedRange months = parser.parseRange("Mar 2021 - 04/2021");

            assertEquals(FlexibleDateParser.Precision.YEAR, years.start().precision());
            assertEquals(FlexibleDateParser.Precision.YEAR, years.end().precision());
            assertEquals(FlexibleDateParser.Precision.MONTH, months.start().precision());
            assertEquals(FlexibleDateParser.Precision.MONTH, months.end().precision());
            assertEquals(FlexibleDateParser.Precision.DAY, parser.parse("2020-01-15").precision());
            assertNull(parser.parse("Present").precision());
            assertEquals(LocalDate.of(2020, 1, 1), FlexibleDateParser.Precision.YEAR.next(LocalDate.of(2019, 1, 1)));
        }

        @Test
        @DisplayName("An ISO date is not mistaken for a range")
        void testIsoDateIsNotRange() {
            ParsedRange range = parser.parseRange("2020-01-15");

            assertEquals(LocalDate.of(2020, 1, 15), range.start().date());
            assertFalse(range.end().isPresent());
        }
    }
}
