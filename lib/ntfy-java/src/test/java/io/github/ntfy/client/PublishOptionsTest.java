package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishOptionsTest {

    @Test
    void defaultsSendNoHeaders() {
        assertThat(PublishOptions.defaults().headers()).isEmpty();
    }

    @Test
    void blankValuesAreDropped() {
        PublishOptions options = PublishOptions.builder()
                .title("  ")
                .tags("", " urgent ")
                .email(null)
                .build();

        Map<String, String> headers = options.headers();
        assertThat(headers).containsOnlyKeys("X-Tags");
        assertThat(headers).containsEntry("X-Tags", "urgent");
    }

    @Test
    void filenameNeedsAttachment() {
        assertThat(PublishOptions.builder().attach(null, "log.txt").build().headers()).isEmpty();
    }

    @Test
    void scheduleAndCacheHeaders() {
        PublishOptions options = PublishOptions.builder()
                .delay("tomorrow, 10am")
                .cache("no")
                .firebase("no")
                .id("msg-1")
                .expires("2h")
                .email("ops@example.com")
                .build();

        assertThat(options.headers())
                .containsEntry("X-Delay", "tomorrow, 10am")
                .containsEntry("X-Cache", "no")
                .containsEntry("X-Firebase", "no")
                .containsEntry("X-ID", "msg-1")
                .containsEntry("X-Expires", "2h")
                .containsEntry("X-Email", "ops@example.com");
    }

    @Test
    void validation() {
        assertThatThrownBy(() -> PublishOptions.builder().priority(0))
                .isInstanceOf(NtfyException.class)
                .hasMessageContaining("between 1 and 5");
        assertThatThrownBy(() -> PublishOptions.builder().priority(6))
                .isInstanceOf(NtfyException.class);
        assertThatThrownBy(() -> PublishOptions.builder().title("two\nlines"))
                .isInstanceOf(NtfyException.class)
                .hasMessageContaining("line breaks");
        assertThatThrownBy(() -> PublishOptions.builder().action(null))
                .isInstanceOf(NtfyException.class);
    }
}
