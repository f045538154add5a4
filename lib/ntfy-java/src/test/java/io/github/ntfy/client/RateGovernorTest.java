package io.github.ntfy.client;

import io.github.ntfy.client.errors.RateLimitedError;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RateGovernorTest {

    private final ManualScheduler time = new ManualScheduler();

    @Test
    void globalLimitPassesExactlyMaxRequestsPerWindow() {
        RateGovernor governor = new RateGovernor(5, Duration.ofSeconds(60), time);

        for (int i = 0; i < 5; i++) {
            governor.checkGlobal();
        }
        RateLimitedError error = catchThrowableOfType(governor::checkGlobal, RateLimitedError.class);

        assertThat(error.getScope()).isEqualTo(RateGovernor.GLOBAL_SCOPE);
        assertThat(error.getRetryAfter()).isEqualTo(Duration.ofSeconds(60));
        assertThat(error).hasMessageContaining("global rate limit exceeded");
    }

    @Test
    void windowResetsAfterItEnds() {
        RateGovernor governor = new RateGovernor(2, Duration.ofSeconds(60), time);
        governor.checkGlobal();
        time.advance(Duration.ofSeconds(20));
        governor.checkGlobal();

        RateLimitedError error = catchThrowableOfType(governor::checkGlobal, RateLimitedError.class);
        assertThat(error.getRetryAfter()).isEqualTo(Duration.ofSeconds(40));

        time.advance(Duration.ofSeconds(40));
        governor.checkGlobal();
        governor.checkGlobal();
    }

    @Test
    void topicLimitIsHalfTheGlobalCappedAtFifty() {
        assertThat(new RateGovernor(100, Duration.ofSeconds(60), time).getTopicLimit()).isEqualTo(50);
        assertThat(new RateGovernor(1000, Duration.ofSeconds(60), time).getTopicLimit()).isEqualTo(50);
        assertThat(new RateGovernor(10, Duration.ofSeconds(60), time).getTopicLimit()).isEqualTo(5);
        assertThat(new RateGovernor(1, Duration.ofSeconds(60), time).getTopicLimit()).isEqualTo(1);
    }

    @Test
    void topicsAreLimitedSeparately() {
        RateGovernor governor = new RateGovernor(10, Duration.ofSeconds(60), time);
        for (int i = 0; i < 5; i++) {
            governor.check("alerts");
        }

        assertThatThrownBy(() -> governor.check("alerts"))
                .isInstanceOf(RateLimitedError.class)
                .hasMessageContaining("rate limit exceeded for topic 'alerts'");
        governor.check("builds");
    }

    @Test
    void topicKeysAreNormalized() {
        RateGovernor governor = new RateGovernor(4, Duration.ofSeconds(60), time);
        governor.checkTopic("Alerts");
        governor.checkTopic(" alerts ");

        RateLimitedError error = catchThrowableOfType(() -> governor.checkTopic("ALERTS"), RateLimitedError.class);

        assertThat(error.getScope()).isEqualTo("alerts");
        assertThat(governor.cachedTopicCount()).isEqualTo(1);
        assertThat(governor.hasTopicBucket("aLeRtS")).isTrue();
    }

    @Test
    void topicCacheEvictsOldestBucket() {
        RateGovernor governor = new RateGovernor(100_000, Duration.ofSeconds(60), time);
        for (int i = 0; i <= RateGovernor.MAX_CACHED_TOPICS; i++) {
            governor.checkTopic("topic-" + i);
        }

        assertThat(governor.cachedTopicCount()).isEqualTo(RateGovernor.MAX_CACHED_TOPICS);
        assertThat(governor.hasTopicBucket("topic-0")).isFalse();
        assertThat(governor.hasTopicBucket("topic-1")).isTrue();
        assertThat(governor.hasTopicBucket("topic-" + RateGovernor.MAX_CACHED_TOPICS)).isTrue();
    }
}
