package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.Headline;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: headlines from the Google News RSS search feed.
 */
@Slf4j
@Service
public class GoogleNewsRssSource implements NewsSource {

    private static final String SEARCH_URL = "https://news.google.com/rss/search";

    private final OkHttpClient httpClient;

    public GoogleNewsRssSource() {
        this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .build());
    }

    GoogleNewsRssSource(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<Headline> headlines(String query, int limit) {
        HttpUrl url = HttpUrl.get(SEARCH_URL).newBuilder()
            .addQueryParameter("q", query)
            .addQueryParameter("hl", "en-US")
            .addQueryParameter("gl", "US")
            .addQueryParameter("ceid", "US:en")
            .build();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36")
            .get()
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("News feed for '{}' failed: HTTP {}", query, response.code());
                return List.of();
            }
            return parse(response.body().string(), Math.max(1, limit));
        } catch (Exception e) {
            log.warn("News feed for '{}' failed: {}", query, e.getMessage());
            return List.of();
        }
    }

    static List<Headline> parse(String xml, int maxItems) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // feeds are untrusted: no DOCTYPE, so no external entities
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        Document doc = factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        NodeList items = doc.getElementsByTagName("item");
        List<Headline> out = new ArrayList<>();
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = text(item, "title");
            if (title.isEmpty()) continue;
            out.add(Headline.builder()
                .title(title)
                .publisher(text(item, "source"))
                .link(text(item, "link"))
                .publishedAt(text(item, "pubDate"))
                .build());
        }
        return out;
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0 || nl.item(0) == null) return "";
        return nl.item(0).getTextContent().trim();
    }
}
