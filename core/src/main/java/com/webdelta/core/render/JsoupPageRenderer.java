package com.webdelta.core.render;

import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;

/**
 * 정적 HTML 렌더러(jsoup). 자바스크립트는 실행하지 않는다.
 * viewport/waitStrategy는 의미가 없어 무시, userAgent와 timeout만 반영.
 * 4xx/5xx 응답도 본문을 그대로 스냅샷한다(헤드리스 브라우저와 같은 동작).
 */
public class JsoupPageRenderer implements IPageRenderer {

    private final JsoupLinkExtractor links = new JsoupLinkExtractor();

    @Override
    public RenderedPage render(String url, RenderOptions options) throws RenderException {
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .userAgent(options.userAgent())
                    .timeout(options.timeoutMs())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .get();
        } catch (SocketTimeoutException e) {
            throw new RenderException(RenderException.Kind.TIMEOUT, url, e.getMessage(), e);
        } catch (UnsupportedMimeTypeException e) {
            throw new RenderException(RenderException.Kind.NAVIGATION, url,
                    "unsupported content type " + e.getMimeType(), e);
        } catch (MalformedURLException | IllegalArgumentException e) {
            // 잘못된 URL 또는 http(s) 외 프로토콜
            throw new RenderException(RenderException.Kind.NAVIGATION, url, e.getMessage(), e);
        } catch (IOException e) {
            throw new RenderException(RenderException.Kind.NETWORK, url, String.valueOf(e.getMessage()), e);
        }
        return new RenderedPage(url, doc.outerHtml(), links.extract(doc));
    }
}
