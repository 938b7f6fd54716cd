package com.gdin.inspection.citegraph.graph.cluster;

import cn.hutool.core.util.StrUtil;
import lombok.Getter;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * TF-IDF 向量化：Lucene 标准分词、小写、去英文停用词、一元 + 二元词组；按语料总词频保留前 maxFeatures 个词，
 * idf = ln((1 + n) / (1 + df)) + 1，每行 L2 归一化。
 */
public class TfidfVectorizer {

    // 标准分词 + 小写 + Lucene 英文停用词，不做词干化
    private static final Analyzer ANALYZER = new StandardAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);

    private final int maxFeatures;

    public TfidfVectorizer(int maxFeatures) {
        this.maxFeatures = maxFeatures;
    }

    /**
     * 分词并去停用词，保留顺序；单字符词丢弃。
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (StrUtil.isBlank(text)) return tokens;
        try (TokenStream stream = ANALYZER.tokenStream("content", text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (term.length() > 1) tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("分词失败", e);
        }
        return tokens;
    }

    static List<String> ngrams(List<String> tokens) {
        List<String> grams = new ArrayList<>(tokens.size() * 2);
        grams.addAll(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            grams.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return grams;
    }

    public Matrix fitTransform(List<String> documents) {
        int n = documents.size();
        List<Map<String, Integer>> counts = new ArrayList<>(n);
        Map<String, Integer> corpusFreq = new HashMap<>();
        for (String doc : documents) {
            Map<String, Integer> c = new LinkedHashMap<>();
            for (String g : ngrams(tokenize(doc))) {
                c.merge(g, 1, Integer::sum);
            }
            c.forEach((term, cnt) -> corpusFreq.merge(term, cnt, Integer::sum));
            counts.add(c);
        }

        // 词表：总词频降序，同频按字典序，截断后再按字典序排列
        List<String> kept = new ArrayList<>(corpusFreq.keySet());
        kept.sort((a, b) -> {
            int cmp = Integer.compare(corpusFreq.get(b), corpusFreq.get(a));
            return cmp != 0 ? cmp : a.compareTo(b);
        });
        if (kept.size() > maxFeatures) kept = kept.subList(0, maxFeatures);
        Map<String, Integer> vocab = new TreeMap<>();
        for (String t : kept) vocab.put(t, 0);
        List<String> terms = new ArrayList<>(vocab.keySet());
        for (int i = 0; i < terms.size(); i++) vocab.put(terms.get(i), i);

        int m = terms.size();
        int[] df = new int[m];
        for (Map<String, Integer> c : counts) {
            for (String term : c.keySet()) {
                Integer idx = vocab.get(term);
                if (idx != null) df[idx]++;
            }
        }
        double[] idf = new double[m];
        for (int j = 0; j < m; j++) {
            idf[j] = Math.log((1.0 + n) / (1.0 + df[j])) + 1.0;
        }

        double[][] rows = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (Map.Entry<String, Integer> e : counts.get(i).entrySet()) {
                Integer idx = vocab.get(e.getKey());
                if (idx != null) rows[i][idx] = e.getValue() * idf[idx];
            }
            normalize(rows[i]);
        }
        return new Matrix(Collections.unmodifiableList(terms), rows);
    }

    private static void normalize(double[] row) {
        double sum = 0;
        for (double v : row) sum += v * v;
        if (sum == 0) return;
        double norm = Math.sqrt(sum);
        for (int j = 0; j < row.length; j++) row[j] /= norm;
    }

    @Getter
    public static class Matrix {
        private final List<String> terms;
        private final double[][] rows;

        Matrix(List<String> terms, double[][] rows) {
            this.terms = terms;
            this.rows = rows;
        }

        /**
         * 行已归一化，点积即余弦相似度。
         */
        public double cosine(int a, int b) {
            double dot = 0;
            double[] x = rows[a];
            double[] y = rows[b];
            for (int j = 0; j < x.length; j++) dot += x[j] * y[j];
            return dot;
        }

        /**
         * 一组行的平均权重最高的前 k 个词（权重为 0 的不返回）。
         */
        public List<String> topTerms(List<Integer> rowIdx, int k) {
            if (rowIdx.isEmpty() || terms.isEmpty()) return List.of();
            double[] mean = new double[terms.size()];
            for (int i : rowIdx) {
                for (int j = 0; j < mean.length; j++) mean[j] += rows[i][j];
            }
            List<Integer> order = new ArrayList<>(mean.length);
            for (int j = 0; j < mean.length; j++) {
                if (mean[j] > 0) order.add(j);
            }
            order.sort((a, b) -> {
                int cmp = Double.compare(mean[b], mean[a]);
                return cmp != 0 ? cmp : terms.get(a).compareTo(terms.get(b));
            });
            List<String> top = new ArrayList<>(Math.min(k, order.size()));
            for (int j = 0; j < order.size() && top.size() < k; j++) top.add(terms.get(order.get(j)));
            return top;
        }
    }
}
