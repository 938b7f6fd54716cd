package com.gdin.inspection.citegraph.graph.source;

import com.gdin.inspection.citegraph.exception.SourceUnavailableException;
import com.gdin.inspection.citegraph.graph.models.PaperRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存里的元数据源，测试用。
 */
public class FakeMetadataSource implements MetadataSource {

    private final Map<String, PaperRecord> papers = new HashMap<>();
    private final Map<String, List<PaperRecord>> references = new HashMap<>();
    private final Map<String, List<PaperRecord>> citers = new HashMap<>();
    private final Set<String> unavailable = new HashSet<>();
    public final AtomicInteger calls = new AtomicInteger();

    public static PaperRecord paper(String id, String title, int year) {
        return PaperRecord.builder()
                .paperId(id)
                .title(title)
                .authors(List.of("Author " + id))
                .year(year)
                .abstractText(title + " abstract")
                .citationCount(10)
                .build();
    }

    public FakeMetadataSource add(PaperRecord record) {
        papers.put(record.getPaperId(), record);
        return this;
    }

    /**
     * from 引用了 to。
     */
    public FakeMetadataSource cites(String from, String to) {
        references.computeIfAbsent(from, k -> new ArrayList<>()).add(link(to));
        citers.computeIfAbsent(to, k -> new ArrayList<>()).add(link(from));
        return this;
    }

    public FakeMetadataSource unavailable(String id) {
        unavailable.add(id);
        return this;
    }

    private PaperRecord link(String id) {
        PaperRecord known = papers.get(id);
        return known != null ? known : PaperRecord.builder().paperId(id).title("Paper " + id).build();
    }

    @Override
    public Optional<PaperRecord> resolve(String identifier) {
        calls.incrementAndGet();
        check(identifier);
        return Optional.ofNullable(papers.get(identifier));
    }

    @Override
    public List<PaperRecord> references(String identifier) {
        calls.incrementAndGet();
        check(identifier);
        return references.getOrDefault(identifier, List.of());
    }

    @Override
    public List<PaperRecord> citers(String identifier) {
        calls.incrementAndGet();
        check(identifier);
        return citers.getOrDefault(identifier, List.of());
    }

    private void check(String identifier) {
        if (unavailable.contains(identifier)) throw new SourceUnavailableException("模拟不可用: " + identifier);
    }
}
