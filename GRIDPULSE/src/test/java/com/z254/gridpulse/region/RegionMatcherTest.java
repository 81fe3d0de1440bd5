package com.z254.gridpulse.region;

import com.z254.gridpulse.domain.model.RegionInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RegionMatcherTest {

    private final RegionMatcher matcher = new RegionMatcher();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(quoteCharacter = '"', value = {
            "Beijing, BJ",
            "beijing, BJ",
            "bj, BJ",
            "北京, BJ",
            "帝都, BJ",
            "Peking, BJ",
            "魔都, SH",
            "Canton, GZ",
            "Xi'an, XA",
            "xian, XA",
            "Greater Shenzhen area, SZ"
    })
    @DisplayName("matches codes, names, local names and aliases")
    void matchesMentions(String mention, String expectedCode) {
        assertThat(matcher.match(mention)).map(RegionInfo::getCode).contains(expectedCode);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Atlantis", "  ", "Paris"})
    @DisplayName("unknown or missing mentions match nothing")
    void unknownMentions(String mention) {
        assertThat(matcher.match(mention)).isEmpty();
    }

    @Test
    @DisplayName("finds a region named inside a query")
    void findsRegionInText() {
        assertThat(matcher.findInText("Forecast Beijing's power demand for the next 30 days"))
                .map(RegionInfo::getName).contains("Beijing");
        assertThat(matcher.findInText("预测上海未来一周的用电负荷"))
                .map(RegionInfo::getCode).contains("SH");
        assertThat(matcher.findInText("What is the weather like?")).isEmpty();
    }

    @Test
    @DisplayName("lists every supported region once")
    void supportedRegions() {
        assertThat(matcher.supportedRegions()).hasSize(10)
                .extracting(RegionInfo::getCode).doesNotHaveDuplicates();
        assertThat(matcher.supportedNames()).contains("Beijing", "Shanghai", "Tianjin");
        assertThat(matcher.byCode("gz")).map(RegionInfo::getName).contains("Guangzhou");
        assertThat(matcher.byCode(null)).isEmpty();
    }
}
