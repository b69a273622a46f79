package com.linlay.llmclient.retry;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryAfterParserTest {

    @Test
    void shouldParseNumericSecondsFromAnyHeaderCase() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("retry-after", "12");

        assertThat(RetryAfterParser.parse(headers)).isEqualTo(Duration.ofSeconds(12));
        assertThat(RetryAfterParser.parse("1.5")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void shouldTreatInvalidValuesAsAbsent() {
        assertThat(RetryAfterParser.parse("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(RetryAfterParser.parse("-3")).isNull();
        assertThat(RetryAfterParser.parse(" ")).isNull();
        assertThat(RetryAfterParser.parse(new HttpHeaders())).isNull();
    }

    @Test
    void shouldTreatValuesBeyondMillisecondRangeAsAbsent() {
        assertThat(RetryAfterParser.parse("18446744073709551616")).isNull();
        assertThat(RetryAfterParser.parse("1e30")).isNull();
        assertThat(RetryAfterParser.parse("0.0004")).isEqualTo(Duration.ofMillis(1));
    }
}
