package com.dramacollector.collect.source;

import com.dramacollector.collect.http.SourceHttpClient;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.model.SourceFetchResult;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.collect.util.SourceFailureClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MyDramaList-style HTML listing pages, used as a fallback when the JSON API is short.
 */
public class WebDramaSource implements DramaSource {
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern EPISODES = Pattern.compile("(\\d+)\\s*(?:episodes|eps|集)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final SourceDescriptor descriptor;
    private final String baseUrl;
    private final int maxPages;
    private final SourceHttpClient httpClient;
    private final TokenBucketRateLimiter rateLimiter;

    public WebDramaSource(
        SourceDescriptor descriptor,
        String baseUrl,
        int maxPages,
        SourceHttpClient httpClient,
        TokenBucketRateLimiter rateLimiter
    ) {
        this.descriptor = descriptor;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.maxPages = Math.max(1, maxPages);
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public List<RawRecord> fetchList(int count) throws SourceException, InterruptedException {
        List<RawRecord> records = new ArrayList<>();
        for (int page = 1; page <= maxPages && records.size() < count; page++) {
            String url = baseUrl + "/search?adv=titles&ty=sh&co=3&page=" + page;
            Document document = fetchDocument(url);
            List<Element> boxes = document.select("div.box");
            int before = records.size();
            for (Element box : boxes) {
                if (records.size() >= count) {
                    break;
                }
                RawRecord record = parseListItem(box);
                if (record != null) {
                    records.add(record);
                }
            }
            if (records.size() == before) {
                break;
            }
        }
        if (records.size() < count) {
            throw new SourceExhaustedException(name(), count, records);
        }
        return records;
    }

    @Override
    public RawRecord fetchDetail(String sourceId) throws SourceException, InterruptedException {
        Document document = fetchDocument(baseUrl + "/" + sourceId);
        Element heading = document.selectFirst("h1.film-title");
        if (heading == null) {
            throw new SourceRejectedException(name(), "detail page for " + sourceId + " has no title");
        }
        DramaAttributes attributes = DramaAttributes.builder()
            .title(heading.text())
            .synopsis(textOf(document.selectFirst("div.show-synopsis")))
            .genres(document.select("li.show-genres a").eachText())
            .tags(document.select("li.show-tags a").eachText())
            .build();
        return new RawRecord(name(), sourceId, attributes);
    }

    private Document fetchDocument(String url) throws SourceException, InterruptedException {
        SourceFetchResult result = httpClient.get(url, ACCEPT_HTML, descriptor.timeout(), rateLimiter);
        if (!result.isSuccessful()) {
            throw SourceFailureClassifier.toException(name(), result);
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new SourceRejectedException(name(), "empty page from " + url);
        }
        return Jsoup.parse(result.body(), url);
    }

    private RawRecord parseListItem(Element box) {
        Element link = box.selectFirst("h6.title a");
        if (link == null) {
            return null;
        }
        String id = idFromHref(link.attr("href"));
        if (id == null) {
            return null;
        }
        String meta = textOf(box.selectFirst("span.text-muted"));
        DramaAttributes attributes = DramaAttributes.builder()
            .title(link.text())
            .year(firstInt(YEAR, meta, 0))
            .episodes(firstInt(EPISODES, meta, 1))
            .rating(parseScore(textOf(box.selectFirst("span.score"))))
            .build();
        return new RawRecord(name(), id, attributes);
    }

    static String idFromHref(String href) {
        if (href == null) {
            return null;
        }
        String path = href.trim();
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String id = slash >= 0 ? path.substring(slash + 1) : path;
        return id.isBlank() ? null : id;
    }

    private static Integer firstInt(Pattern pattern, String text, int group) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(group));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseScore(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SCORE.matcher(text);
        return matcher.find() ? Double.parseDouble(matcher.group()) : null;
    }

    private static String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.text();
        return text.isBlank() ? null : text;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
