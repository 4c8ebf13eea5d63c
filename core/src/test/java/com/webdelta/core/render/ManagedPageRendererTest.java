package com.webdelta.core.render;

import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.RenderOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ManagedPageRenderer: 지연 획득 / 상태 확인 / 재획득")
class ManagedPageRendererTest {

    private static final String U = "https://ex.com/";

    /** 생성할 때마다 새 FakeSite를 만들어 기록해 두는 팩토리 */
    static final class RecordingFactory implements PageRendererFactory {
        final List<FakeSite> created = new ArrayList<>();
        @Override public IPageRenderer create() {
            FakeSite s = new FakeSite().page(U, "t");
            created.add(s);
            return s;
        }
    }

    @Test
    @DisplayName("첫 렌더 전에는 세션을 만들지 않는다")
    void lazyAcquire() throws Exception {
        RecordingFactory f = new RecordingFactory();
        try (ManagedPageRenderer m = new ManagedPageRenderer(f)) {
            assertThat(f.created).isEmpty();
            assertThat(m.isHealthy()).isTrue();

            m.render(U, RenderOptions.defaults());
            m.render(U, RenderOptions.defaults());

            assertThat(f.created).hasSize(1);
            assertThat(m.getAcquisitions()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("세션이 망가지면 닫고 다음 렌더 전에 새로 만든다")
    void reacquiresWhenUnhealthy() throws Exception {
        RecordingFactory f = new RecordingFactory();
        try (ManagedPageRenderer m = new ManagedPageRenderer(f)) {
            m.render(U, RenderOptions.defaults());
            f.created.get(0).healthy(false);

            m.render(U, RenderOptions.defaults());

            assertThat(f.created).hasSize(2);
            assertThat(f.created.get(0).isClosed()).isTrue();
            assertThat(f.created.get(1).rendered()).containsExactly(U);
            assertThat(m.getAcquisitions()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("세션 획득 실패는 RendererUnavailableException")
    void acquireFailureIsFatal() {
        ManagedPageRenderer m = new ManagedPageRenderer(() -> { throw new IllegalStateException("no browser"); });

        assertThatThrownBy(m::warmUp)
                .isInstanceOf(RendererUnavailableException.class)
                .hasMessageContaining("no browser")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("팩토리가 null을 돌려줘도 RendererUnavailableException")
    void nullSessionIsFatal() {
        ManagedPageRenderer m = new ManagedPageRenderer(() -> null);

        assertThatThrownBy(() -> m.render(U, RenderOptions.defaults()))
                .isInstanceOf(RendererUnavailableException.class);
    }

    @Test
    @DisplayName("페이지 단위 실패는 그대로 전달하고 세션은 유지")
    void pageFailurePassesThrough() throws Exception {
        RecordingFactory f = new RecordingFactory();
        try (ManagedPageRenderer m = new ManagedPageRenderer(f)) {
            assertThatThrownBy(() -> m.render("https://ex.com/missing", RenderOptions.defaults()))
                    .isInstanceOf(RenderException.class)
                    .extracting(e -> ((RenderException) e).getKind())
                    .isEqualTo(RenderException.Kind.NAVIGATION);

            m.render(U, RenderOptions.defaults());
            assertThat(f.created).hasSize(1);
        }
    }

    @Test
    @DisplayName("close()는 현재 세션을 닫는다")
    void closeClosesDelegate() throws Exception {
        RecordingFactory f = new RecordingFactory();
        ManagedPageRenderer m = new ManagedPageRenderer(f);
        m.warmUp();
        m.close();
        assertThat(f.created.get(0).isClosed()).isTrue();
    }
}
