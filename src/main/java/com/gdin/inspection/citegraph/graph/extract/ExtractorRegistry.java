package com.gdin.inspection.citegraph.graph.extract;

import com.gdin.inspection.citegraph.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 显式注册的抽取器表，按注册顺序列出。
 */
public class ExtractorRegistry {

    private final Map<String, Extractor> extractors = new LinkedHashMap<>();

    public ExtractorRegistry(List<Extractor> extractors) {
        for (Extractor e : extractors) {
            if (this.extractors.putIfAbsent(e.name(), e) != null) {
                throw new IllegalArgumentException("抽取器重名: " + e.name());
            }
        }
    }

    /**
     * @throws InvalidRequestException 未注册的名称
     */
    public Extractor get(String name) {
        Extractor e = name == null ? null : extractors.get(name.trim());
        if (e == null) throw new InvalidRequestException("未知的抽取器: " + name + "，可用: " + names());
        return e;
    }

    public List<String> names() {
        return new ArrayList<>(extractors.keySet());
    }
}
