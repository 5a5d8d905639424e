package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.Headline;
import org.junit.jupiter.api.Test;
import org.xml.sax.SAXParseException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleNewsRssSourceTest {

    private static final String FEED = """
        <?xml version="1.0" encoding="UTF-8"?>
        <rss version="2.0"><channel><title>Search</title>
          <item>
            <title>Fed holds rates steady</title>
            <link>https://example.com/a</link>
            <pubDate>Thu, 16 Oct 2026 13:00:00 GMT</pubDate>
            <source url="https://example.com">Example Wire</source>
          </item>
          <item><title>  </title></item>
          <item><title>Treasury yields climb</title></item>
          <item><title>Dollar slips</title></item>
        </channel></rss>
        """;

    @Test
    void parsesItemsUpToTheLimitAndSkipsUntitledOnes() throws Exception {
        List<Headline> headlines = GoogleNewsRssSource.parse(FEED, 2);

        assertThat(headlines).extracting(Headline::getTitle)
            .containsExactly("Fed holds rates steady", "Treasury yields climb");
        Headline first = headlines.get(0);
        assertThat(first.getPublisher()).isEqualTo("Example Wire");
        assertThat(first.getLink()).isEqualTo("https://example.com/a");
        assertThat(first.getPublishedAt()).startsWith("Thu, 16 Oct 2026");
        assertThat(headlines.get(1).getPublisher()).isEmpty();
    }

    @Test
    void rejectsFeedsDeclaringExternalEntities() {
        String hostile = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE rss [<!ENTITY leak SYSTEM "file:///etc/hostname">]>
            <rss version="2.0"><channel><item><title>&leak;</title></item></channel></rss>
            """;

        assertThatThrownBy(() -> GoogleNewsRssSource.parse(hostile, 5))
            .isInstanceOf(SAXParseException.class)
            .hasMessageContaining("DOCTYPE");
    }
}
