package com.gdin.inspection.citegraph.util;

import cn.hutool.core.util.StrUtil;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import org.springframework.stereotype.Component;

@Component
public class TokenUtil {

    private final Encoding encoding;

    public TokenUtil() {
        encoding = Encodings.newLazyEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    public int getTokenCount(String text) {
        if (StrUtil.isEmpty(text)) return 0;
        return encoding.countTokens(text);
    }

    /**
     * 截断到 maxTokens 个 token，未超出时原样返回。
     */
    public String truncate(String text, int maxTokens) {
        if (StrUtil.isEmpty(text) || maxTokens <= 0) return "";
        EncodingResult result = encoding.encode(text, maxTokens);
        if (!result.isTruncated()) return text;
        return encoding.decode(result.getTokens());
    }
}
