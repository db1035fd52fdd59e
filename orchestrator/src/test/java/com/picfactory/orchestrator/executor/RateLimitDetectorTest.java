package com.picfactory.orchestrator.executor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pure unit tests for RateLimitDetector: no browser, no Spring.
 */
class RateLimitDetectorTest {

    // ------------------------------------------------------------------
    // detect()
    // ------------------------------------------------------------------

    @Test
    void detect_englishNoticeWithMinutes_parsesWaitAndSummaryLine() {
        String page = """
                ChatGPT
                You've hit the rate limit for image generation.
                Please try again in 3 minutes.
                """;

        RateLimitDetector.Signal signal = RateLimitDetector.detect(page).orElseThrow();

        assertThat(signal.waitSeconds()).isEqualTo(180);
        assertThat(signal.message()).isEqualTo("You've hit the rate limit for image generation.");
    }

    @Test
    void detect_chineseNoticeWithSeconds() {
        RateLimitDetector.Signal signal = RateLimitDetector.detect("请求过于频繁，请等待 45 秒后再试").orElseThrow();

        assertThat(signal.waitSeconds()).isEqualTo(45);
        assertThat(signal.message()).contains("频繁");
    }

    @Test
    void detect_noDuration_usesFifteenMinuteDefault() {
        RateLimitDetector.Signal signal = RateLimitDetector.detect("Too many requests").orElseThrow();

        assertThat(signal.waitSeconds()).isEqualTo(RateLimitDetector.DEFAULT_WAIT_SECONDS).isEqualTo(900);
    }

    @Test
    void detect_ordinaryPage_returnsEmpty() {
        assertThat(RateLimitDetector.detect("Here is your watercolor cat.")).isEmpty();
        assertThat(RateLimitDetector.detect("")).isEmpty();
        assertThat(RateLimitDetector.detect(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // parseWaitSeconds()
    // ------------------------------------------------------------------

    @Test
    void parseWaitSeconds_minutesCheckedBeforeSeconds() {
        assertThat(RateLimitDetector.parseWaitSeconds("wait 1 minute 30 seconds")).hasValue(60);
    }

    @Test
    void parseWaitSeconds_hoursAndChineseUnits() {
        assertThat(RateLimitDetector.parseWaitSeconds("try again in 2 hours")).hasValue(7200);
        assertThat(RateLimitDetector.parseWaitSeconds("请 5 分钟后重试")).hasValue(300);
        assertThat(RateLimitDetector.parseWaitSeconds("1小时后恢复")).hasValue(3600);
    }

    @Test
    void parseWaitSeconds_zeroOrMissing_isEmpty() {
        assertThat(RateLimitDetector.parseWaitSeconds("try again in 0 seconds")).isEmpty();
        assertThat(RateLimitDetector.parseWaitSeconds("Timeout 15000ms exceeded.")).isEmpty();
        assertThat(RateLimitDetector.parseWaitSeconds(null)).isEmpty();
    }

    @Test
    void parseWaitSeconds_hugeValues_areCappedAtOneDay() {
        assertThat(RateLimitDetector.parseWaitSeconds("try again in 99999999999999999 minutes"))
                .hasValue(RateLimitDetector.MAX_WAIT_SECONDS);
        assertThat(RateLimitDetector.parseWaitSeconds("wait 999999999999999999 hours"))
                .hasValue(RateLimitDetector.MAX_WAIT_SECONDS);
        assertThat(RateLimitDetector.parseWaitSeconds("try again in 30 hours")).hasValue(86_400);
    }

    @Test
    void clampWaitSeconds_keepsWithinOneSecondAndOneDay() {
        assertThat(RateLimitDetector.clampWaitSeconds(0)).isEqualTo(1);
        assertThat(RateLimitDetector.clampWaitSeconds(90)).isEqualTo(90);
        assertThat(RateLimitDetector.clampWaitSeconds(Long.MAX_VALUE)).isEqualTo(86_400);
    }
}
