package com.webdelta.core.render;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import com.webdelta.core.model.WaitStrategy;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsoupPageRenderer: 로컬 HTTP 서버 대상")
class JsoupPageRendererTest {

    static HttpServer s;
    static String base;
    static volatile String lastUserAgent;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        s.createContext("/", ex -> {
            lastUserAgent = ex.getRequestHeaders().getFirst("User-Agent");
            respond(ex, 200, "text/html; charset=utf-8", """
                <html><head><title>Home</title></head><body>
                  <a href="/about">about</a>
                  <a href="about">dup-relative</a>
                  <a href="/about">dup</a>
                  <a href="mailto:x@ex.com">mail</a>
                  <a href="https://other.example.org/x">ext</a>
                  <map><area href="/area"></map>
                </body></html>
                """);
        });
        s.createContext("/gone", ex -> respond(ex, 404, "text/html; charset=utf-8",
                "<html><head><title>Not here</title></head></html>"));
        s.createContext("/file.bin", ex -> respond(ex, 200, "application/octet-stream", "xx"));
        s.start();
        base = "http://localhost:" + s.getAddress().getPort();
    }

    @AfterAll
    static void down() { s.stop(0); }

    static void respond(HttpExchange ex, int code, String ctype, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", ctype);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    private static RenderOptions opts() {
        return new RenderOptions(1920, 1080, "webdelta-test/1.0", WaitStrategy.LOAD, 5000);
    }

    @Test
    @DisplayName("HTML과 절대 http(s) 링크를 문서 순서로 중복 없이 돌려준다")
    void rendersHtmlAndLinks() throws Exception {
        RenderedPage p = new JsoupPageRenderer().render(base + "/", opts());

        assertThat(p.getUrl()).isEqualTo(base + "/");
        assertThat(p.getHtml()).contains("<title>Home</title>");
        assertThat(p.getOutboundLinks()).containsExactly(
                base + "/about", "https://other.example.org/x", base + "/area");
        assertThat(lastUserAgent).isEqualTo("webdelta-test/1.0");
    }

    @Test
    @DisplayName("4xx 응답도 본문을 스냅샷한다")
    void errorPagesAreSnapshotted() throws Exception {
        RenderedPage p = new JsoupPageRenderer().render(base + "/gone", opts());
        assertThat(p.getHtml()).contains("Not here");
    }

    @Test
    @DisplayName("HTML이 아닌 응답은 NAVIGATION 실패")
    void nonHtmlIsNavigationFailure() {
        assertThatThrownBy(() -> new JsoupPageRenderer().render(base + "/file.bin", opts()))
                .isInstanceOf(RenderException.class)
                .extracting(e -> ((RenderException) e).getKind())
                .isEqualTo(RenderException.Kind.NAVIGATION);
    }

    @Test
    @DisplayName("연결 거부는 NETWORK 실패")
    void refusedConnectionIsNetworkFailure() throws Exception {
        int freePort;
        try (ServerSocket ss = new ServerSocket(0)) { freePort = ss.getLocalPort(); }

        assertThatThrownBy(() -> new JsoupPageRenderer().render("http://localhost:" + freePort + "/", opts()))
                .isInstanceOf(RenderException.class)
                .extracting(e -> ((RenderException) e).getKind())
                .isEqualTo(RenderException.Kind.NETWORK);
    }

    @Test
    @DisplayName("http(s)가 아닌 URL은 NAVIGATION 실패")
    void malformedUrlIsNavigationFailure() {
        assertThatThrownBy(() -> new JsoupPageRenderer().render("ftp://ex.com/", opts()))
                .isInstanceOf(RenderException.class)
                .extracting(e -> ((RenderException) e).getKind())
                .isEqualTo(RenderException.Kind.NAVIGATION);
    }
}
