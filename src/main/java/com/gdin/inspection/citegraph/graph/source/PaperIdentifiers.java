package com.gdin.inspection.citegraph.graph.source;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 论文标识符归一化。
 * <ul>
 *     <li>40 位十六进制的 S2 paperId：转小写</li>
 *     <li>DOI（含 doi: 前缀或 doi.org 链接）：DOI:小写 doi</li>
 *     <li>arXiv（含 arXiv: 前缀或 arxiv.org 链接）：ARXIV:去掉版本号的 id</li>
 *     <li>CorpusId:数字</li>
 * </ul>
 * 其余输入视为标题，只做首尾去空白。
 */
public final class PaperIdentifiers {

    private static final Pattern S2_ID = Pattern.compile("^[0-9a-fA-F]{40}$");
    private static final Pattern DOI_PREFIX = Pattern.compile("^(?:https?://(?:dx\\.)?doi\\.org/|doi:)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOI = Pattern.compile("^10\\.\\d{4,9}/\\S+$");
    private static final Pattern ARXIV_PREFIX = Pattern.compile("^(?:https?://(?:www\\.)?arxiv\\.org/(?:abs|pdf)/|arxiv:)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_NEW = Pattern.compile("^(\\d{4}\\.\\d{4,5})(?:v\\d+)?(?:\\.pdf)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_OLD = Pattern.compile("^([a-z\\-]+(?:\\.[a-z]{2})?/\\d{7})(?:v\\d+)?(?:\\.pdf)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CORPUS_ID = Pattern.compile("^corpusid:(\\d+)$", Pattern.CASE_INSENSITIVE);

    private PaperIdentifiers() {
    }

    /**
     * @return 归一化后的标识符；空白输入返回 null
     */
    public static String normalize(String raw) {
        if (StrUtil.isBlank(raw)) return null;
        String s = raw.trim();
        if (S2_ID.matcher(s).matches()) return s.toLowerCase(Locale.ROOT);

        Matcher corpus = CORPUS_ID.matcher(s);
        if (corpus.matches()) return "CorpusId:" + corpus.group(1);

        String doi = DOI_PREFIX.matcher(s).replaceFirst("");
        if (DOI.matcher(doi).matches()) return "DOI:" + doi.toLowerCase(Locale.ROOT);

        String arxiv = ARXIV_PREFIX.matcher(s).replaceFirst("");
        Matcher m = ARXIV_NEW.matcher(arxiv);
        if (m.matches()) return "ARXIV:" + m.group(1);
        m = ARXIV_OLD.matcher(arxiv);
        // 旧式 id 只接受显式前缀，避免把 "a/1234567" 之类的标题误判
        if (m.matches() && !arxiv.equals(s)) return "ARXIV:" + m.group(1).toLowerCase(Locale.ROOT);

        return s;
    }

    /**
     * 归一化结果是否可以直接按 id 查询（否则按标题搜索）。
     */
    public static boolean isLookupKey(String normalized) {
        if (normalized == null) return false;
        return S2_ID.matcher(normalized).matches()
                || normalized.startsWith("DOI:")
                || normalized.startsWith("ARXIV:")
                || normalized.startsWith("CorpusId:");
    }
}
