package com.gdin.inspection.citegraph.graph.source;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.SourceUnavailableException;
import com.gdin.inspection.citegraph.graph.models.PaperRecord;
import com.gdin.inspection.citegraph.util.IOUtil;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Semantic Scholar Graph API v1 适配器。
 * <p>
 * 重试交给 resilience4j：
 * 1. 超时 / IO 异常 / 5xx 视为瞬时失败，按 base, 2*base, 4*base ... 退避，最多 maxAttempts 次；
 * 2. 429 优先按 Retry-After 等待，没有则等待配置的冷却时间；最后一次仍是 429 时再额外冷却重试一次；
 * 3. 404 / 400 视为查无此文，返回空结果；其它 4xx 与无法识别的响应直接失败。
 */
@Slf4j
@Component
public class SemanticScholarMetadataSource implements MetadataSource {

    static final String PAPER_FIELDS = "paperId,externalIds,title,authors,year,publicationDate,venue,abstract,citationCount,url";
    static final String LINK_FIELDS = "paperId,externalIds,title,authors,year,venue,citationCount,isInfluential,contexts";

    private final RestTemplate restTemplate;
    private final GraphProperties.SemanticScholar props;
    private final int maxAttempts;
    private final Retry retry;

    @Autowired
    public SemanticScholarMetadataSource(@Qualifier("semanticScholarRestTemplate") RestTemplate restTemplate,
                                         GraphProperties graphProperties) {
        this(restTemplate, graphProperties.getSemanticScholar());
    }

    public SemanticScholarMetadataSource(RestTemplate restTemplate, GraphProperties.SemanticScholar props) {
        this.restTemplate = restTemplate;
        this.props = props;
        this.maxAttempts = Math.max(1, props.getMaxAttempts());
        this.retry = buildRetry(props, maxAttempts);
    }

    @Override
    public Optional<PaperRecord> resolve(String identifier) {
        String key = PaperIdentifiers.normalize(identifier);
        if (key == null) return Optional.empty();

        if (PaperIdentifiers.isLookupKey(key)) {
            URI uri = UriComponentsBuilder.fromUriString(props.getBaseUrl())
                    .path("/paper/{id}")
                    .queryParam("fields", PAPER_FIELDS)
                    .buildAndExpand(key)
                    .encode()
                    .toUri();
            String body = get(uri);
            if (body == null) return Optional.empty();
            return Optional.ofNullable(toRecord(parse(body, SemanticScholarModels.Paper.class, uri)));
        }

        // 不是标识符，按标题搜索取第一条
        URI uri = UriComponentsBuilder.fromUriString(props.getBaseUrl())
                .path("/paper/search")
                .queryParam("query", "{query}")
                .queryParam("limit", 1)
                .queryParam("fields", PAPER_FIELDS)
                .encode()
                .buildAndExpand(key)
                .toUri();
        String body = get(uri);
        if (body == null) return Optional.empty();
        SemanticScholarModels.SearchPage page = parse(body, SemanticScholarModels.SearchPage.class, uri);
        if (page == null || CollectionUtil.isEmpty(page.getData())) {
            log.info("按标题未检索到论文: {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(toRecord(page.getData().get(0)));
    }

    @Override
    public List<PaperRecord> references(String identifier) {
        return links(identifier, "references");
    }

    @Override
    public List<PaperRecord> citers(String identifier) {
        return links(identifier, "citations");
    }

    private List<PaperRecord> links(String identifier, String relation) {
        String key = PaperIdentifiers.normalize(identifier);
        if (key == null || !PaperIdentifiers.isLookupKey(key)) return List.of();
        URI uri = UriComponentsBuilder.fromUriString(props.getBaseUrl())
                .path("/paper/{id}/" + relation)
                .queryParam("fields", LINK_FIELDS)
                .queryParam("limit", props.getPageLimit())
                .buildAndExpand(key)
                .encode()
                .toUri();
        String body = get(uri);
        if (body == null) return List.of();
        SemanticScholarModels.LinkPage page = parse(body, SemanticScholarModels.LinkPage.class, uri);
        if (page == null || page.getData() == null) return List.of();

        List<PaperRecord> records = new ArrayList<>(page.getData().size());
        for (SemanticScholarModels.Link link : page.getData()) {
            SemanticScholarModels.Paper paper = "references".equals(relation) ? link.getCitedPaper() : link.getCitingPaper();
            PaperRecord record = toRecord(paper);
            if (record == null) continue;
            records.add(record.toBuilder()
                    .influential(link.getIsInfluential())
                    .citationContext(CollectionUtil.isEmpty(link.getContexts()) ? null : link.getContexts().get(0))
                    .build());
        }
        log.debug("{} 的 {} 共 {} 条", key, relation, records.size());
        return records;
    }

    /**
     * 带重试的 GET。
     *
     * @return 响应体；查无此文时返回 null
     */
    String get(URI uri) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> call = () -> {
            int attempt = attempts.incrementAndGet();
            try {
                ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
                return response.getBody();
            } catch (HttpClientErrorException.NotFound e) {
                log.info("元数据源未找到: {}", uri.getPath());
                return null;
            } catch (HttpClientErrorException.BadRequest e) {
                log.warn("元数据源拒绝了请求，按未找到处理: {} {}", uri.getPath(), e.getStatusText());
                return null;
            } catch (HttpClientErrorException.TooManyRequests e) {
                log.warn("元数据源限流(第{}次): {}", attempt, uri.getPath());
                throw e;
            } catch (HttpServerErrorException | ResourceAccessException e) {
                // 额外的一次只留给限流
                if (attempt >= maxAttempts) throw unavailable(uri, attempt, e);
                log.warn("元数据源瞬时失败(第{}次): {} {}", attempt, uri.getPath(), e.getMessage());
                throw e;
            } catch (HttpClientErrorException e) {
                throw new SourceUnavailableException("元数据源拒绝访问: " + e.getStatusCode() + " " + uri.getPath(), e);
            } catch (RestClientException e) {
                throw new SourceUnavailableException("元数据源响应异常: " + uri.getPath() + " " + e.getMessage(), e);
            }
        };
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw unavailable(uri, attempts.get(), e);
        }
    }

    Retry retry() {
        return retry;
    }

    private static Retry buildRetry(GraphProperties.SemanticScholar props, int maxAttempts) {
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(Math.max(1L, props.getBaseDelayMillis()), 2);
        RetryConfig config = RetryConfig.<String>custom()
                // 最后一次仍被限流时再冷却一次
                .maxAttempts(maxAttempts + 1)
                .retryExceptions(HttpClientErrorException.TooManyRequests.class,
                        HttpServerErrorException.class, ResourceAccessException.class)
                .intervalBiFunction((attempt, outcome) -> {
                    if (outcome.isLeft() && outcome.getLeft() instanceof HttpClientErrorException.TooManyRequests e) {
                        return retryAfterMillis(e.getResponseHeaders()).orElse(props.getRateLimitCooldownMillis());
                    }
                    return backoff.apply(attempt);
                })
                .build();
        Retry retry = Retry.of("semantic-scholar", config);
        retry.getEventPublisher().onRetry(event -> log.debug("元数据源第{}次重试，等待 {}ms",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
        return retry;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StrUtil.isNotBlank(props.getApiKey())) headers.set("x-api-key", props.getApiKey());
        return headers;
    }

    private SourceUnavailableException unavailable(URI uri, int attempts, Exception cause) {
        log.error("元数据源重试 {} 次后仍不可用: {}", attempts, uri.getPath());
        return new SourceUnavailableException("元数据源不可用(" + attempts + " 次尝试): " + uri.getPath(), cause);
    }

    /**
     * Retry-After 支持秒数与 HTTP 日期两种格式。
     */
    static Optional<Long> retryAfterMillis(HttpHeaders headers) {
        if (headers == null) return Optional.empty();
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (StrUtil.isBlank(value)) return Optional.empty();
        value = value.trim();
        if (value.matches("\\d{1,9}")) return Optional.of(Long.parseLong(value) * 1000L);
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Optional.of(Math.max(0L, Duration.between(ZonedDateTime.now(at.getZone()), at).toMillis()));
        } catch (DateTimeParseException e) {
            log.debug("无法解析 Retry-After: {}", value);
            return Optional.empty();
        }
    }

    private <T> T parse(String body, Class<T> clazz, URI uri) {
        try {
            return IOUtil.jsonDeserializeWithNoType(body, clazz);
        } catch (IOException e) {
            throw new SourceUnavailableException("元数据源返回了无法解析的内容: " + uri.getPath(), e);
        }
    }

    static PaperRecord toRecord(SemanticScholarModels.Paper paper) {
        if (paper == null) return null;
        // 引用列表里偶尔会有只剩标题、没有 paperId 的条目
        if (StrUtil.isBlank(paper.getPaperId()) && StrUtil.isBlank(paper.getTitle())) return null;

        List<String> authors = new ArrayList<>();
        if (paper.getAuthors() != null) {
            for (SemanticScholarModels.Author a : paper.getAuthors()) {
                if (a != null && StrUtil.isNotBlank(a.getName())) authors.add(a.getName());
            }
        }
        Map<String, Object> ext = paper.getExternalIds() == null ? Map.of() : paper.getExternalIds();
        Object doi = ext.get("DOI");
        Object arxiv = ext.get("ArXiv");
        return PaperRecord.builder()
                .paperId(StrUtil.isBlank(paper.getPaperId()) ? null : paper.getPaperId().toLowerCase(Locale.ROOT))
                .title(paper.getTitle())
                .authors(authors)
                .year(paper.getYear())
                .publicationDate(parseDate(paper.getPublicationDate()))
                .venue(StrUtil.emptyToNull(paper.getVenue()))
                .doi(doi == null ? null : String.valueOf(doi))
                .arxivId(arxiv == null ? null : String.valueOf(arxiv))
                .url(paper.getUrl())
                .abstractText(paper.getAbstractText())
                .citationCount(paper.getCitationCount())
                .build();
    }

    private static LocalDate parseDate(String value) {
        if (StrUtil.isBlank(value)) return null;
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("无法解析发表日期: {}", value);
            return null;
        }
    }
}
