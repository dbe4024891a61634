package tech.idmirror.platform.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class PageTest {

    @Test
    @DisplayName("the extra row should only signal that another page exists")
    void of_shouldTrimExtraRow() {
        Page<String> page = Page.of(List.of("c", "b", "a"), 2, Function.identity());

        assertThat(page.items()).containsExactly("c", "b");
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextCursor()).isEqualTo("b");
    }

    @Test
    @DisplayName("the last page should have no cursor")
    void of_shouldEndWithoutCursor() {
        Page<String> page = Page.of(List.of("a"), 2, Function.identity());

        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
        assertThat(Page.<String>of(List.of(), 2, Function.identity())).isEqualTo(Page.empty());
    }
}
